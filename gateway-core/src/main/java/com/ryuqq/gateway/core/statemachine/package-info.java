/**
 * Event-driven state machine package.
 *
 * <p>This package implements a thread-safe registry of named states and guarded
 * transitions, with event dispatch, bounded history and a transition listener.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.gateway.core.statemachine.StateMachine} - Registry, lifecycle and event dispatch</li>
 *   <li>{@link com.ryuqq.gateway.core.statemachine.State} - Named state with enter/exit/update/event hooks</li>
 *   <li>{@link com.ryuqq.gateway.core.statemachine.Transition} - (from, event) → to, with optional guard</li>
 *   <li>{@link com.ryuqq.gateway.core.statemachine.TransitionGuard} - Predicate over the event payload</li>
 *   <li>{@link com.ryuqq.gateway.core.statemachine.TransitionListener} - Observer fired on every transition</li>
 * </ul>
 *
 * <h2>Dispatch Rules</h2>
 * <pre>
 * 1. current.onEvent(event, data) == true  → handled, no transition
 * 2. transition (current, event) exists and guard passes → transition
 * 3. otherwise → no transition (guard false / guard threw / no entry)
 *
 * Transition callback order (outside the lock):
 *   from.onExit() → listener(from, to) → to.onEnter(data)
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * StateMachine machine = new StateMachine();
 * machine.addState("idle", idleState);
 * machine.addState("running", runningState);
 * machine.addTransition("idle", "start", "running");
 * machine.setInitialState("idle");
 * machine.start();
 *
 * machine.triggerEvent("start");   // idle → running
 * </pre>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>No user code under the lock:</strong> callbacks may re-enter the machine</li>
 *   <li><strong>Boolean results:</strong> rejected mutations return false and change nothing</li>
 *   <li><strong>Cascading removal:</strong> removing a state removes every transition touching it</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Gateway Team
 */
package com.ryuqq.gateway.core.statemachine;
