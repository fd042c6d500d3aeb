/**
 * Batch Applier - pending 작업을 Store에 독립적으로 적용.
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>전제 조건:</strong> 해소되지 않은 모호성이 있으면 배치 전체 거부</li>
 *   <li><strong>작업 단위 격리:</strong> 한 작업의 실패는 해당 작업만 FAILED, 롤백 없음</li>
 *   <li><strong>이름 바인딩:</strong> 적용 시점에 Store에서 이름을 다시 해석</li>
 * </ul>
 *
 * @author Evolution Team
 * @since 1.0.0
 */
package com.ryuqq.evolution.application.applier;
