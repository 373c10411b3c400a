package com.refharvest.core.download;

import com.refharvest.core.model.Placement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

class FileNamingTest {

    @Test
    @DisplayName("MIRRORED: 경로 세그먼트가 디렉터리가 된다")
    void mirrored_keeps_path() {
        URI u = URI.create("https://ex.com/files/2024/alpha-numeric%20hcpcs.zip");

        assertEquals("files/2024/alpha-numeric_hcpcs.zip", FileNaming.nameFor(u, Placement.MIRRORED, FileNaming.fileNameOf(u)));
    }

    @Test
    void flat_drops_directories() {
        URI u = URI.create("https://ex.com/files/2024/codes.zip");

        assertEquals("codes.zip", FileNaming.nameFor(u, Placement.FLAT, FileNaming.fileNameOf(u)));
    }

    @Test
    @DisplayName("경로에 이름이 없으면 file= 쿼리 값")
    void file_query_param() {
        assertEquals("Loinc_2.77.zip", FileNaming.fileNameOf(URI.create("https://ex.com/dl?file=sub%2FLoinc_2.77.zip&x=1")));
        assertNull(FileNaming.fileNameOf(URI.create("https://ex.com/dl/?id=4")));
    }

    @Test
    @DisplayName("'..' 세그먼트는 출력 디렉터리를 벗어나지 못한다")
    void dot_segments_are_neutralised() {
        assertEquals("_", FileNaming.sanitize(".."));
        assertEquals("a_b_c", FileNaming.sanitize("a b?c"));
    }

    @Test
    void content_disposition_variants() {
        assertEquals("report 2024.pdf", FileNaming.fromContentDisposition("attachment; filename=\"report 2024.pdf\""));
        assertEquals("코드.csv", FileNaming.fromContentDisposition("attachment; filename*=UTF-8''%EC%BD%94%EB%93%9C.csv; filename=\"x.csv\""));
        assertEquals("evil.zip", FileNaming.fromContentDisposition("attachment; filename=C:\\tmp\\evil.zip"));
        assertNull(FileNaming.fromContentDisposition("inline"));
        assertNull(FileNaming.fromContentDisposition(null));
    }
}
