/**
 * Evolution Application Layer - 스키마 편집 세션 API.
 *
 * <p>{@link com.ryuqq.evolution.application.session.EvolutionSession}은 하나의
 * {@link com.ryuqq.evolution.core.spi.MetamodelStore}를 중심으로 Interpreter, Ledger,
 * Resolver, Applier, Reporter를 연결합니다.</p>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> Store는 포트(SPI), 구현체는 adapter 모듈에 위치</li>
 *   <li><strong>의존성 주입:</strong> 전역 상태 없이 생성 시점에 Store 주입</li>
 *   <li><strong>단일 스레드:</strong> 세션 하나를 한 호출자가 구동</li>
 * </ul>
 *
 * @author Evolution Team
 * @since 1.0.0
 */
package com.ryuqq.evolution.application.session;
