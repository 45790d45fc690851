
/**
 * Switch Shell Transport Ports
 * =============================================================================
 *
 * These interfaces define the boundary between an interactive CLI transport
 * (SSH via JSch in production, a scripted fake in tests) and the switch
 * session state machine.
 *
 * <h2>Why these ports exist</h2>
 * The session and command engine reason about prompts, privilege and tables.
 * They never see SSH channels, byte streams or expect buffers. Everything
 * above this package sees only:
 * <ul>
 *   <li>Commands as single text lines</li>
 *   <li>Device output as decoded text with line boundaries preserved</li>
 *   <li>Failures as {@link java.io.IOException}</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 * Implementations MUST:
 * <ul>
 *   <li>Block until one of the requested signals appears, or the configured
 *       command timeout elapses</li>
 *   <li>Not interpret command output</li>
 *   <li>Not retry commands</li>
 * </ul>
 *
 * A transport is owned by exactly one session and is not thread-safe.
 */
package com.questrail.noc.switching.transport;
