/**
 * Model Co-evolution 경계 (현재 미지원 구현만 제공).
 *
 * @author Evolution Team
 * @since 1.0.0
 */
package com.ryuqq.evolution.application.coevolution;
