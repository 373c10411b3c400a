package com.refharvest.core.model;

/** 링크 분류: 더 탐색할 페이지 / 내려받을 파일 */
public enum ResourceKind { PAGE, FILE }
