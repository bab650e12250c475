/**
 * Runtime composition package.
 *
 * <p>{@link io.agentgovernor.runtime.GovernorRuntime} wires the arbitrator, budget engine,
 * circuit breaker and event bus into one admission flow and records every decision in the
 * audit log. Apart from the arbitrator consulting the loop detector, the components never
 * call each other, and none of them writes to the audit sink.
 */
package io.agentgovernor.runtime;
