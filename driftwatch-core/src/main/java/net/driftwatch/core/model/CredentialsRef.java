package net.driftwatch.core.model;

/** 자격증명 조회 키. 실제 비밀값은 스크레이퍼 구현이 외부 저장소에서 해석한다. */
public record CredentialsRef(String userId, String kind) {}
