/**
 * 동시성 보호 계약.
 *
 * <ul>
 *   <li>{@link com.ryuqq.flowbatch.core.protection.Bulkhead} - 라인 동시 실행 상한</li>
 *   <li>{@link com.ryuqq.flowbatch.core.protection.BulkheadConfig} - 상한 설정</li>
 * </ul>
 *
 * <p>구현체는 adapter-runner 모듈의 {@code SemaphoreBulkhead}에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.flowbatch.core.protection;
