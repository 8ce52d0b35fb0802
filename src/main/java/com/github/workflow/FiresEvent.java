package com.github.workflow;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Maps a method of a {@link WorkflowProxy} interface onto an event whose name is not a legal Java
 * identifier or differs from the method name.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface FiresEvent {

  /**
   * The event name.
   */
  String value();
}
