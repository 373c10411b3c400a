package com.refharvest.core.service.export;

import com.refharvest.core.model.HarvestReport;

import java.io.IOException;
import java.nio.file.Path;

/** 실행 요약을 파일로 내보내는 책임 */
public interface ReportExporter {
    /**
     * @param baseDir 출력 루트(null이면 "downloads")
     * @param target  시드 URL(경로의 host/slug 결정)
     * @return 생성된 파일 경로
     */
    Path export(Path baseDir, String target, HarvestReport report) throws IOException;
}
