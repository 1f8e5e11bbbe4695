/**
 * Merge 작업 조정.
 *
 * <p>Namespace 상태 전이는 저장소의 compare-and-set으로 수행하며,
 * Namespace당 활성 Merge 작업은 {@code insertIfNoActive}로 하나만 허용합니다 (force 제외).</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.privatefm.application.merge;
