/**
 * Evolution Ledger - append-only 작업 이력과 pending / ambiguity 인덱스.
 *
 * @author Evolution Team
 * @since 1.0.0
 */
package com.ryuqq.evolution.application.ledger;
