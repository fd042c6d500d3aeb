/**
 * Ambiguity Resolver - AMBIGUOUS 작업을 resolution 데이터로 PENDING 전환.
 *
 * @author Evolution Team
 * @since 1.0.0
 */
package com.ryuqq.evolution.application.resolver;
