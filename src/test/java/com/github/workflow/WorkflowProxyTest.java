package com.github.workflow;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.UUID;

import org.junit.Test;

/**
 * Tests for calling events as interface methods.
 */
public class WorkflowProxyTest {

  public interface Article {
    boolean submit() throws WorkflowException;

    TransitionResult review() throws WorkflowException;

    void accept(String reviewer) throws WorkflowException, HaltedException;

    @FiresEvent("reject")
    boolean decline(String reviewer) throws WorkflowException;

    @StatePredicate("new")
    boolean isNew();

    @StatePredicate("accepted")
    boolean isAccepted();

    Workflow workflow();

    default String describe() {
      return "article in " + workflow().getCurrentStateName();
    }
  }

  public interface Unmappable {
    boolean submit();
  }

  public interface BadPredicate {
    @StatePredicate("new")
    String isNew();
  }

  private static Workflow bindArticle() throws WorkflowException {
    final Specification specification = SpecificationBuilder
        .newBuilder("ProxiedArticle-" + UUID.randomUUID())
        .state("new", state -> state.event("submit", "awaiting_review"))
        .state("awaiting_review", state -> state.event("review", "being_reviewed"))
        .state("being_reviewed", state -> state
            .event("accept", "accepted", context -> {
              if ("nobody".equals(context.getArg(0, String.class))) {
                context.halt("coz I said so!");
              }
            })
            .event("reject", "rejected"))
        .state("accepted")
        .state("rejected")
        .build();
    return Workflow.bind(specification);
  }

  @Test
  public void testEventsAsMethods() throws WorkflowException {
    final Workflow workflow = bindArticle();
    final Article article = WorkflowProxy.newProxy(Article.class, workflow);
    assertSame(workflow, article.workflow());
    assertTrue(article.isNew());
    assertFalse(article.isAccepted());

    assertTrue(article.submit());
    final TransitionResult reviewed = article.review();
    assertEquals("being_reviewed", reviewed.getToState().getName());
    assertEquals("article in being_reviewed", article.describe());

    article.accept("editor");
    assertTrue(article.isAccepted());
    assertEquals("accepted", workflow.getCurrentStateName());
  }

  @Test
  public void testRenamedEventPassesArguments() throws WorkflowException {
    final Workflow workflow = Workflow.restore(bindArticle().getSpecification(), null,
        "being_reviewed");
    final Article article = WorkflowProxy.newProxy(Article.class, workflow);
    assertTrue(article.decline("editor"));
    assertEquals("rejected", workflow.getCurrentStateName());
  }

  @Test
  public void testHaltRaisedThroughDeclaredException() throws WorkflowException {
    final Workflow workflow = Workflow.restore(bindArticle().getSpecification(), null,
        "being_reviewed");
    final Article article = WorkflowProxy.newProxy(Article.class, workflow);
    try {
      article.accept("nobody");
      fail("accept should have been halted");
    } catch (HaltedException expected) {
      assertEquals("coz I said so!", expected.getReason().get());
    }
    assertTrue(workflow.isHalted());
    assertEquals("being_reviewed", workflow.getCurrentStateName());
  }

  @Test
  public void testUndefinedEventKeepsEngineDiagnostic() throws WorkflowException {
    final Article article = WorkflowProxy.newProxy(Article.class, bindArticle());
    try {
      article.accept("editor");
      fail("accept is not legal in new");
    } catch (UndefinedTransitionException expected) {
      assertEquals("new", expected.getStateName());
      assertEquals(Collections.singletonList("submit"), expected.getLegalEvents());
    }
    assertTrue(article.isNew());
  }

  @Test
  public void testObjectMethods() throws WorkflowException {
    final Article article = WorkflowProxy.newProxy(Article.class, bindArticle());
    assertTrue(article.equals(article));
    assertFalse(article.equals(WorkflowProxy.newProxy(Article.class, bindArticle())));
    assertEquals(System.identityHashCode(article), article.hashCode());
    assertTrue(article.toString().startsWith("WorkflowProxy [Workflow [id="));
  }

  @Test
  public void testUnmappableContracts() throws WorkflowException {
    final Workflow workflow = bindArticle();
    for (final Class<?> contract : Arrays.asList(Unmappable.class, BadPredicate.class,
        String.class)) {
      try {
        WorkflowProxy.newProxy(contract, workflow);
        fail(contract + " cannot be mapped");
      } catch (IllegalArgumentException expected) {
      }
    }
  }
}
