/**
 * Error taxonomy for batch runs.
 *
 * <h2>Classification</h2>
 * <ul>
 *   <li>{@link com.ryuqq.flowbatch.core.error.FlowBatchException} - classified domain error, propagated unchanged</li>
 *   <li>{@link com.ryuqq.flowbatch.core.error.UnexpectedBatchException} - wrapper for anything unclassified</li>
 *   <li>{@link com.ryuqq.flowbatch.core.error.LineFailureException} - fail-fast summary of failed lines</li>
 * </ul>
 *
 * <p>Line-level failures are not exceptions: they are recorded as FAILED line results.
 * Cancellation is not an error either.</p>
 *
 * @since 1.0.0
 * @author FlowBatch Team
 */
package com.ryuqq.flowbatch.core.error;
