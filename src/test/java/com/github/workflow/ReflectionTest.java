package com.github.workflow;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;

/**
 * Tests for read-only introspection over compiled specifications.
 */
public class ReflectionTest {

  @Test
  public void testSpecificationGraph() throws WorkflowException {
    final AtomicInteger routines = new AtomicInteger();
    final Map<String, Object> submitMeta = new LinkedHashMap<>();
    submitMeta.put("label", "Submit for review");
    submitMeta.put("roles", Arrays.asList("author", "editor"));
    final Map<String, Object> reviewMeta = new LinkedHashMap<>();
    reviewMeta.put("color", "amber");

    final Specification specification = SpecificationBuilder
        .newBuilder("Reflection-" + UUID.randomUUID())
        .state("new", state -> state.event("submit", "awaiting_review", submitMeta,
            context -> routines.incrementAndGet()))
        .state("awaiting_review", state -> state
            .event("review", "being_reviewed")
            .event("withdraw", "new")
            .meta(reviewMeta)
            .onEntry((workflow, prior, event, args) -> routines.incrementAndGet()))
        .state("being_reviewed", state -> state
            .event("accept", "accepted")
            .event("publish", "published"))
        .state("accepted")
        .onTransition((workflow, from, to, event, args) -> routines.incrementAndGet())
        .build();

    // 1. states in declaration order
    assertEquals(Arrays.asList("new", "awaiting_review", "being_reviewed", "accepted"),
        specification.getStateNames());
    final List<String> iterated = new ArrayList<>();
    for (final State state : specification.getStates()) {
      iterated.add(state.getName());
    }
    assertEquals(specification.getStateNames(), iterated);
    assertEquals("new", specification.getInitialState().getName());
    assertTrue(specification.hasState("accepted"));
    assertFalse(specification.hasState("published"));
    assertNull(specification.getState("published"));
    assertEquals(1, specification.getTransitionHooks().size());

    // 2. events, targets and meta per state
    final State awaiting = specification.getState("awaiting_review");
    assertEquals(Arrays.asList("review", "withdraw"), awaiting.getEventNames());
    assertEquals("new", awaiting.getEvent("withdraw").getTransitionsTo());
    assertEquals("amber", awaiting.getMeta().get("color"));
    assertTrue(awaiting.getOnEntry().isPresent());
    assertFalse(awaiting.getOnExit().isPresent());
    assertNull(awaiting.getEvent("accept"));

    final Event submit = specification.getState("new").getEvent("submit");
    assertEquals("awaiting_review", submit.getTransitionsTo());
    assertEquals("Submit for review", submit.getMeta().get("label", String.class));
    assertEquals(Arrays.asList("author", "editor"), submit.getMeta().get("roles"));
    assertTrue(submit.getAction().isPresent());
    assertTrue(specification.getState("accepted").getMeta().isEmpty());
    assertTrue(specification.getState("accepted").getEvents().isEmpty());

    // 3. a dangling target is reported as declared, not validated
    assertEquals("published",
        specification.getState("being_reviewed").getEvent("publish").getTransitionsTo());

    // 4. nothing ran
    assertEquals(0, routines.get());
  }

  @Test
  public void testStatesCompareByDeclarationOrder() throws WorkflowException {
    final Specification specification = SpecificationBuilder
        .newBuilder("Ordering-" + UUID.randomUUID())
        .state("draft").state("review").state("published").build();
    final State draft = specification.getState("draft");
    final State review = specification.getState("review");
    final State published = specification.getState("published");
    assertEquals(0, draft.getPosition());
    assertTrue(draft.compareTo(review) < 0);
    assertTrue(published.compareTo(review) > 0);
    assertEquals(0, review.compareTo(review));
  }

  @Test
  public void testReflectionIsReadOnly() throws WorkflowException {
    final Specification specification = SpecificationBuilder
        .newBuilder("ReadOnly-" + UUID.randomUUID())
        .state("a", state -> state.event("go", "b")).build();
    try {
      specification.getStateNames().add("b");
      fail("state names are read-only");
    } catch (UnsupportedOperationException expected) {
    }
    try {
      specification.getStates().clear();
      fail("states are read-only");
    } catch (UnsupportedOperationException expected) {
    }
    try {
      specification.getState("a").getEventNames().remove(0);
      fail("event names are read-only");
    } catch (UnsupportedOperationException expected) {
    }
    try {
      specification.getState("a").getMeta().asMap().put("k", "v");
      fail("meta is read-only");
    } catch (UnsupportedOperationException expected) {
    }
    try {
      specification.getTransitionHooks().add((workflow, from, to, event, args) -> {
      });
      fail("transition hooks are read-only");
    } catch (UnsupportedOperationException expected) {
    }
  }
}
