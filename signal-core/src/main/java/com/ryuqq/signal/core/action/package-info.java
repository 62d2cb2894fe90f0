/**
 * Named, signature-tagged callables.
 *
 * @since 1.0.0
 * @author Signal Team
 */
package com.ryuqq.signal.core.action;
