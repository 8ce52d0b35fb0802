package com.github.workflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Global registry of all specifications that exist within a jvm process, keyed by name. A name is
 * registered on its first declaration and merged into on every later one; entries are never
 * removed.
 */
public final class SpecificationRegistry {
  private static final Logger logger =
      LogManager.getLogger(SpecificationRegistry.class.getSimpleName());

  private final ConcurrentMap<String, Specification> allSpecifications = new ConcurrentHashMap<>();

  private static final SpecificationRegistry instance = new SpecificationRegistry();

  public static SpecificationRegistry getInstance() {
    return instance;
  }

  /**
   * Register the draft under its name, or merge it into the specification already registered under
   * that name. Returns the registered specification.
   */
  synchronized Specification define(final Specification draft,
      final WorkflowConfiguration config) throws WorkflowException {
    final Specification existing = allSpecifications.get(draft.getName());
    if (existing == null) {
      allSpecifications.put(draft.getName(), draft);
      logger.info(String.format("Registered workflow '%s' with states %s, initial state '%s'",
          draft.getName(), draft.getStateNames(),
          draft.getInitialState() == null ? null : draft.getInitialState().getName()));
      return draft;
    }
    existing.merge(draft, config.getRedefinitionPolicy());
    logger.info(String.format("Re-opened workflow '%s', states now %s", existing.getName(),
        existing.getStateNames()));
    return existing;
  }

  /**
   * Returns null if nothing is registered under the name.
   */
  public Specification lookup(final String name) {
    return name == null ? null : allSpecifications.get(name);
  }

  public Specification require(final String name) throws WorkflowException {
    final Specification specification = lookup(name);
    if (specification == null) {
      throw new WorkflowException(WorkflowException.Code.UNKNOWN_SPECIFICATION,
          "No workflow is registered under the name '" + name + "'");
    }
    return specification;
  }

  public boolean contains(final String name) {
    return lookup(name) != null;
  }

  public List<String> names() {
    final List<String> names = new ArrayList<>(allSpecifications.keySet());
    Collections.sort(names);
    return Collections.unmodifiableList(names);
  }

  private SpecificationRegistry() {
    logger.info("Fired up global workflow specification registry");
  }

}
