package com.refharvest.core.util;

@FunctionalInterface
public interface ProgressListener {
    /**
     * @param phase   "login" | "terms" | "crawl" | "download" | "done"
     * @param subject 현재 처리 중인 URL(없으면 null)
     * @param pages   지금까지 방문한 페이지 수
     * @param files   지금까지 저장한 파일 수
     */
    void onProgress(String phase, String subject, long pages, long files);

    ProgressListener NONE = (phase, s, p, f) -> {};
}
