/**
 * File Adapter Layer - JSON Lines 입출력.
 *
 * <ul>
 *   <li>{@link com.ryuqq.flowbatch.adapter.file.JsonLinesInputResolver} - 입력 디렉토리의 *.jsonl 읽기 및 매핑</li>
 *   <li>{@link com.ryuqq.flowbatch.adapter.file.JsonLinesOutputWriter} - output.jsonl 쓰기</li>
 * </ul>
 *
 * <p>JSON 처리는 Jackson ObjectMapper를 사용합니다.</p>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
package com.ryuqq.flowbatch.adapter.file;
