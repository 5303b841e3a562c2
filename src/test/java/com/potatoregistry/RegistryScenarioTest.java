package com.potatoregistry;

import com.potatoregistry.gc.BlobGarbageCollector;
import com.potatoregistry.storage.HashAlgo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End to end over HTTP: an author publishes, a build downloads, a typo'd republish is refused,
 * the version is deleted and then published again with new content.
 */
@SpringBootTest(properties = {
        "registry.scheduling.enabled=false",
        "spring.datasource.url=jdbc:h2:mem:scenario;DB_CLOSE_DELAY=-1"
})
@AutoConfigureMockMvc
class RegistryScenarioTest {

    @TempDir
    static Path storage;

    @DynamicPropertySource
    static void storagePath(DynamicPropertyRegistry registry) {
        registry.add("registry.storage.path", () -> storage.toString());
    }

    @Autowired
    MockMvc mvc;

    @Autowired
    BlobGarbageCollector gc;

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static String sha256(byte[] b) {
        return HashAlgo.toHex(HashAlgo.SHA256.newDigest().digest(b));
    }

    private ResultActions publish(String name, String version, byte[] body) throws Exception {
        return mvc.perform(put("/api/packages/{name}/{version}", name, version)
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .param("hash", sha256(body))
                .param("size", String.valueOf(body.length))
                .content(body));
    }

    private byte[] download(String name, String version) throws Exception {
        MvcResult started = mvc.perform(get("/api/packages/{name}/download", name).param("version", version))
                .andExpect(status().isOk())
                .andReturn();
        return mvc.perform(asyncDispatch(started))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsByteArray();
    }

    @Test
    void leftPadLifecycle() throws Exception {
        byte[] b1 = bytes("function leftPad(s, n) { return s.padStart(n); }");
        byte[] b2 = bytes("function leftPad(s, n, c) { return s.padStart(n, c); }");

        publish("left-pad", "1.0.0", b1).andExpect(status().isCreated());
        publish("left-pad", "1.0.0", b1).andExpect(status().isOk()).andExpect(jsonPath("$.created").value(false));
        assertThat(download("left-pad", "1.0.0")).isEqualTo(b1);

        publish("left-pad", "1.0.0", b2)
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("CONFLICT"));
        assertThat(download("left-pad", "latest")).isEqualTo(b1);

        mvc.perform(delete("/api/packages/left-pad/1.0.0").param("reason", "wrong padding"))
                .andExpect(status().isOk());
        mvc.perform(get("/api/packages/left-pad/download").param("version", "1.0.0"))
                .andExpect(status().isNotFound());

        publish("left-pad", "1.0.0", b2).andExpect(status().isCreated());
        assertThat(download("left-pad", "1.0.0")).isEqualTo(b2);

        // b1 is no longer referenced by any entry
        BlobGarbageCollector.Result swept = gc.collect(Duration.ZERO);
        assertThat(swept.blobsDeleted()).isEqualTo(1);
        assertThat(download("left-pad", "1.0.0")).isEqualTo(b2);
    }

    @Test
    void corruptUploadIsRejected() throws Exception {
        byte[] body = bytes("right-pad");

        mvc.perform(put("/api/packages/right-pad/0.1.0")
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .param("hash", sha256(bytes("something else")))
                        .param("size", String.valueOf(body.length))
                        .content(body))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("INTEGRITY"));

        mvc.perform(get("/api/packages/right-pad/versions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.versions").isEmpty());
    }

    @Test
    void rangeDownloadAndListing() throws Exception {
        publish("is-even", "1.0.0", bytes("even 1.0")).andExpect(status().isCreated());
        publish("is-even", "1.1.0", bytes("even 1.1")).andExpect(status().isCreated());
        publish("is-even", "2.0.0-rc1", bytes("even 2 rc")).andExpect(status().isCreated());

        assertThat(download("is-even", "[1.0,2.0-alpha)")).isEqualTo(bytes("even 1.1"));
        assertThat(download("is_even", "latest")).isEqualTo(bytes("even 2 rc"));

        mvc.perform(get("/api/packages/is-even/versions"))
                .andExpect(jsonPath("$.versions[0]").value("2.0.0-rc1"))
                .andExpect(jsonPath("$.versions[2]").value("1.0.0"));
        mvc.perform(get("/api/packages/is-even"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entries.length()").value(3));
    }

    @Test
    void healthReportsStorage() throws Exception {
        mvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.components.storage.status").value("UP"));
    }
}
