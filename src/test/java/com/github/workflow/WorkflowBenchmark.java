package com.github.workflow;

import java.util.UUID;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;

/**
 * Micro-benchmark of binding a workflow and driving it through a full review cycle.
 */
@org.openjdk.jmh.annotations.State(Scope.Benchmark)
public class WorkflowBenchmark {
  private Specification article;

  @Setup
  public void setUp() throws WorkflowException {
    // 1. compile the specification once, as a host would at startup
    article = SpecificationBuilder.newBuilder("BenchmarkArticle-" + UUID.randomUUID())
        .state("new", state -> state.event("submit", "awaiting_review"))
        .state("awaiting_review", state -> state.event("review", "being_reviewed"))
        .state("being_reviewed", state -> state
            .event("accept", "accepted", context -> {
              if (context.getArgCount() > 0) {
                context.halt("vetoed");
              }
            })
            .onExit((workflow, next, event, args) -> {
            }))
        .state("accepted", state -> state.onEntry((workflow, prior, event, args) -> {
        }))
        .onTransition((workflow, from, to, event, args) -> {
        })
        .build();
  }

  @Benchmark
  public boolean testWorkflowCycle() throws WorkflowException {
    // 2. bind a fresh instance
    final Workflow workflow = Workflow.bind(article);

    // 3a. new->awaiting_review
    boolean transitioned = workflow.fire("submit").isSuccessful();

    // 3b. awaiting_review->being_reviewed
    transitioned &= workflow.fire("review").isSuccessful();

    // 3c. halted accept, then being_reviewed->accepted
    transitioned &= workflow.fire("accept", "veto").isHalted();
    transitioned &= workflow.fire("accept").isSuccessful();
    return transitioned && workflow.isState("accepted");
  }

  public static void main(String args[]) throws WorkflowException {
    WorkflowBenchmark benchmark = new WorkflowBenchmark();
    benchmark.setUp();
    System.out.println("cycle completed: " + benchmark.testWorkflowCycle());
  }

}
