package com.github.workflow;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Proxy;

/**
 * Lets host code call events as methods of an interface instead of going through
 * {@link Workflow#fire(String, Object...)}:
 *
 * <pre>
 * interface Article {
 *   boolean submit() throws WorkflowException;
 *   void accept(String reviewer) throws WorkflowException, HaltedException;
 *   &#64;StatePredicate("accepted") boolean isAccepted();
 * }
 * Article article = WorkflowProxy.newProxy(Article.class, workflow);
 * </pre>
 *
 * Mapping rules:<br>
 * 1. a method annotated with {@link StatePredicate} checks the current state.<br>
 * 2. a no-argument method returning {@link Workflow} returns the bound workflow.<br>
 * 3. any other abstract method fires the event named by {@link FiresEvent}, or by the method name,
 * with the method arguments as event arguments. It may return void, boolean (success) or
 * {@link TransitionResult}, and must declare {@link WorkflowException}. Declaring
 * {@link HaltedException} explicitly selects the raising form.<br>
 * 4. default methods run as written.<br>
 *
 * Undefined events raise the engine's own {@link UndefinedTransitionException}.
 */
public final class WorkflowProxy implements InvocationHandler {
  private final Workflow workflow;

  private WorkflowProxy(final Workflow workflow) {
    this.workflow = workflow;
  }

  /**
   * @throws IllegalArgumentException if the contract is not an interface or one of its methods
   *         cannot be mapped
   */
  public static <T> T newProxy(final Class<T> contract, final Workflow workflow) {
    if (contract == null || !contract.isInterface()) {
      throw new IllegalArgumentException("Workflow proxy contract must be an interface");
    }
    if (workflow == null) {
      throw new IllegalArgumentException("Workflow proxy needs a bound workflow");
    }
    for (final Method method : contract.getMethods()) {
      if (!method.isDefault() && !Modifier.isStatic(method.getModifiers())) {
        verify(method);
      }
    }
    return contract.cast(Proxy.newProxyInstance(contract.getClassLoader(),
        new Class<?>[] {contract}, new WorkflowProxy(workflow)));
  }

  @Override
  public Object invoke(final Object proxy, final Method method, final Object[] args)
      throws Throwable {
    if (method.getDeclaringClass() == Object.class) {
      return invokeObjectMethod(proxy, method, args);
    }
    if (method.isDefault()) {
      return InvocationHandler.invokeDefault(proxy, method, args);
    }
    final StatePredicate predicate = method.getAnnotation(StatePredicate.class);
    if (predicate != null) {
      return workflow.isState(predicate.value());
    }
    if (isWorkflowAccessor(method)) {
      return workflow;
    }
    final Object[] eventArgs = args == null ? new Object[0] : args;
    final TransitionResult result = raises(method)
        ? workflow.fireOrThrow(eventName(method), eventArgs)
        : workflow.fire(eventName(method), eventArgs);
    final Class<?> returnType = method.getReturnType();
    if (returnType == boolean.class || returnType == Boolean.class) {
      return result.isSuccessful();
    }
    if (returnType == TransitionResult.class) {
      return result;
    }
    return null;
  }

  static String eventName(final Method method) {
    final FiresEvent firesEvent = method.getAnnotation(FiresEvent.class);
    return firesEvent != null ? firesEvent.value() : method.getName();
  }

  private static boolean raises(final Method method) {
    for (final Class<?> declared : method.getExceptionTypes()) {
      if (declared == HaltedException.class) {
        return true;
      }
    }
    return false;
  }

  private static boolean isWorkflowAccessor(final Method method) {
    return method.getParameterCount() == 0 && method.getReturnType() == Workflow.class;
  }

  private static void verify(final Method method) {
    if (method.getAnnotation(StatePredicate.class) != null) {
      if (method.getParameterCount() != 0 || method.getReturnType() != boolean.class) {
        throw new IllegalArgumentException(
            "State predicate " + method + " must take no arguments and return boolean");
      }
      return;
    }
    if (isWorkflowAccessor(method)) {
      return;
    }
    final Class<?> returnType = method.getReturnType();
    if (returnType != void.class && returnType != boolean.class && returnType != Boolean.class
        && returnType != TransitionResult.class) {
      throw new IllegalArgumentException(
          "Event method " + method + " must return void, boolean or TransitionResult");
    }
    boolean declaresWorkflowException = false;
    for (final Class<?> declared : method.getExceptionTypes()) {
      if (declared.isAssignableFrom(WorkflowException.class)) {
        declaresWorkflowException = true;
      }
    }
    if (!declaresWorkflowException) {
      throw new IllegalArgumentException(
          "Event method " + method + " must declare " + WorkflowException.class.getSimpleName());
    }
  }

  private Object invokeObjectMethod(final Object proxy, final Method method, final Object[] args) {
    switch (method.getName()) {
      case "equals":
        return proxy == args[0];
      case "hashCode":
        return System.identityHashCode(proxy);
      case "toString":
        return "WorkflowProxy [" + workflow + "]";
      default:
        throw new UnsupportedOperationException(method.toString());
    }
  }
}
