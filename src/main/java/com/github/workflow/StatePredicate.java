package com.github.workflow;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a no-argument boolean method of a {@link WorkflowProxy} interface as a check for the named
 * state, eg. {@code @StatePredicate("awaiting_review") boolean isAwaitingReview();}
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface StatePredicate {

  /**
   * The state name.
   */
  String value();
}
