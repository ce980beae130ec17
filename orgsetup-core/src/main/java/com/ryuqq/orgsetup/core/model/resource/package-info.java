/**
 * 셋업 단계가 생성하는 외부 리소스와 생성 요청 본문.
 */
package com.ryuqq.orgsetup.core.model.resource;
