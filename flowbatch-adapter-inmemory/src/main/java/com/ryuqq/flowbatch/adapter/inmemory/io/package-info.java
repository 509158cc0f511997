/**
 * 메모리 기반 입력 해석기와 출력 저장기.
 *
 * <p>파일 시스템 없이 배치를 실행하는 테스트와 임베디드 환경에서 사용합니다.
 * 파일 기반 구현은 flowbatch-adapter-file 모듈에 있습니다.</p>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
package com.ryuqq.flowbatch.adapter.inmemory.io;
