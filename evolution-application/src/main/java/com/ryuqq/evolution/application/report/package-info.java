/**
 * Evolution Reporter - 원장의 읽기 전용 보고서.
 *
 * @author Evolution Team
 * @since 1.0.0
 */
package com.ryuqq.evolution.application.report;
