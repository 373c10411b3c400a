package com.refharvest.core.download;

import java.io.IOException;
import java.io.InputStream;

/**
 * 수집 결과 (이름, 바이트) 스트림의 소비자.
 * 기본은 파일 시스템(FileSystemSink)이지만 CSV 변환기 같은 외부 협력자를 꽂을 수 있다.
 */
public interface ResourceSink {

    /** 같은 이름의 비어 있지 않은 결과가 이미 있는가(재실행 시 재다운로드 방지) */
    boolean exists(String name);

    /**
     * 본문을 chunkSize 단위로 읽어 name 아래에 저장하고 바이트 수를 돌려준다.
     * 실패 시 부분 결과를 남기지 않는다.
     */
    long write(String name, InputStream body, int chunkSize) throws IOException;
}
