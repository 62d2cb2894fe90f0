/**
 * Unchecked exception hierarchy of the Signal SDK.
 *
 * <ul>
 *   <li>{@link com.ryuqq.signal.core.exception.TypeMismatchException} - erased call disagrees with declared types</li>
 *   <li>{@link com.ryuqq.signal.core.exception.SignatureMismatchException} - Action attached to an incompatible channel</li>
 *   <li>{@link com.ryuqq.signal.core.exception.UnknownKeyException} - key not (or no longer) registered</li>
 *   <li>{@link com.ryuqq.signal.core.exception.HandlerFailureException} - aggregated handler failures under the CONTINUE policy</li>
 * </ul>
 *
 * <p>The first three signal misuse at the call site and are never retryable.
 * Null or malformed arguments are rejected with {@link java.lang.IllegalArgumentException}.</p>
 *
 * @since 1.0.0
 * @author Signal Team
 */
package com.ryuqq.signal.core.exception;
