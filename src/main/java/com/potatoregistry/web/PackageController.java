package com.potatoregistry.web;

import com.potatoregistry.catalog.CatalogEntry;
import com.potatoregistry.error.IntegrityException;
import com.potatoregistry.registry.PackageRegistry;
import com.potatoregistry.retrieval.FetchedArtifact;
import com.potatoregistry.upload.PublishResult;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/packages")
@RequiredArgsConstructor
public class PackageController {

    private final PackageRegistry registry;

    // 본문은 그대로 스트리밍; 해시/크기는 쿼리 파라미터로 선언
    @PutMapping(value = "/{name}/{version}", consumes = MediaType.APPLICATION_OCTET_STREAM_VALUE)
    public ResponseEntity<Map<String, Object>> publish(@PathVariable String name, @PathVariable String version,
                                                       @RequestParam String hash, @RequestParam long size,
                                                       HttpServletRequest req) throws IOException {
        PublishResult r;
        try (InputStream in = req.getInputStream()) {
            r = registry.publish(name, version, in, hash, size);
        }
        Map<String, Object> body = Map.of(
                "ok", true,
                "name", r.name(),
                "version", r.version(),
                "hash", r.contentHash(),
                "size", r.sizeBytes(),
                "created", r.created());
        return ResponseEntity.status(r.created() ? HttpStatus.CREATED : HttpStatus.OK).body(body);
    }

    // version 생략 시 최신 버전
    @GetMapping("/{name}/download")
    public ResponseEntity<StreamingResponseBody> download(@PathVariable String name,
                                                          @RequestParam(defaultValue = "latest") String version) {
        FetchedArtifact a = registry.fetch(name, version);
        StreamingResponseBody body = out -> {
            try (FetchedArtifact artifact = a) {
                artifact.stream().transferTo(out);
            } catch (IntegrityException e) {
                // 헤더는 이미 전송됨: 연결을 끊어 클라이언트가 불완전한 응답을 받게 함
                log.error("download of {} {} aborted: {}", a.name(), a.version(), e.getMessage());
                throw e;
            }
        };
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .contentLength(a.size())
                .eTag("\"" + a.hash() + "\"")
                .header("X-Content-Hash", a.hash())
                .header("X-Package-Version", a.version())
                .body(body);
    }

    @DeleteMapping("/{name}/{version}")
    public Map<String, Object> delete(@PathVariable String name, @PathVariable String version,
                                      @RequestParam(required = false) String reason) {
        registry.delete(name, version, reason);
        return Map.of("ok", true, "name", name, "version", version);
    }

    @DeleteMapping("/{name}")
    public Map<String, Object> deletePackage(@PathVariable String name, @RequestParam(required = false) String reason) {
        int deleted = registry.deletePackage(name, reason);
        return Map.of("ok", true, "name", name, "deleted", deleted);
    }

    @GetMapping("/{name}/versions")
    public Map<String, Object> versions(@PathVariable String name) {
        return Map.of("ok", true, "name", name, "versions", registry.listVersions(name));
    }

    @GetMapping
    public Map<String, Object> packages() {
        return Map.of("ok", true, "packages", registry.listPackages());
    }

    @GetMapping("/{name}")
    public Map<String, Object> describe(@PathVariable String name) {
        List<CatalogEntry> entries = registry.describe(name);
        return Map.of("ok", true, "name", entries.get(0).name(), "entries", entries);
    }
}
