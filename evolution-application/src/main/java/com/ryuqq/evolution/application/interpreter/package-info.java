/**
 * Operation Interpreter - Change Descriptor를 Evolution Operation으로 해석.
 *
 * <h2>핵심 클래스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.evolution.application.interpreter.OperationInterpreter} - 해석 및 원장 기록</li>
 *   <li>{@link com.ryuqq.evolution.application.interpreter.IntentFactory} - 세부 정보 → 의도 (기본값 적용)</li>
 *   <li>{@link com.ryuqq.evolution.application.interpreter.IntentValidator} - Store 기준 참조/유일성 검증</li>
 *   <li>{@link com.ryuqq.evolution.application.interpreter.InterpreterConfig} - 기본값 설정</li>
 * </ul>
 *
 * @author Evolution Team
 * @since 1.0.0
 */
package com.ryuqq.evolution.application.interpreter;
