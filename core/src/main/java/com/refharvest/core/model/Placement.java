package com.refharvest.core.model;

/**
 * 저장 위치 규칙.
 * MIRRORED: 원격 경로 세그먼트마다 디렉터리(직접 탐색으로 발견한 파일)
 * FLAT: 출력 디렉터리 바로 아래(약관 동의 흐름으로 발견한 파일)
 */
public enum Placement { MIRRORED, FLAT }
