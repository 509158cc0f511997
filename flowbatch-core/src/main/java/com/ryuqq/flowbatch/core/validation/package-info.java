/**
 * Flow validation and line input normalization (defaults, type coercion).
 *
 * @since 1.0.0
 * @author FlowBatch Team
 */
package com.ryuqq.flowbatch.core.validation;
