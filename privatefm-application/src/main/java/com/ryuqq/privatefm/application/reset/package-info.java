/**
 * 과목 Adapter Reset: 요청, 승인 라우팅, 실행.
 *
 * @since 1.0.0
 */
package com.ryuqq.privatefm.application.reset;
