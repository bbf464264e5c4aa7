package dao.tron.txverify.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dao.tron.txverify.config.StorageProperties;
import dao.tron.txverify.exception.CollaboratorException;
import dao.tron.txverify.exception.TransientCollaboratorException;
import dao.tron.txverify.exception.VerificationCancelledException;
import dao.tron.txverify.model.BatchContents;
import dao.tron.txverify.model.BatchDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Fetches batch payloads over HTTPS.
 *
 * Storage references may be {@code s3://bucket/key} (mapped to the bucket's virtual-hosted URL
 * in {@code storage.region}), absolute http(s) URLs, or plain keys resolved against
 * {@code storage.base-url}.
 *
 * Requests run on the JDK HTTP client so that interrupting the calling thread abandons the
 * exchange instead of waiting out the read timeout.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "storage", name = "mode", havingValue = "http", matchIfMissing = true)
public class HttpBatchContentStore implements BatchContentStore {

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final StorageProperties props;

    public HttpBatchContentStore(StorageProperties props, ObjectMapper objectMapper) {
        this.props = props;
        this.objectMapper = objectMapper;

        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(props.getConnectTimeoutMs()))
                .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(Duration.ofMillis(props.getReadTimeoutMs()));
        this.restClient = RestClient.builder().requestFactory(factory).build();
    }

    @Override
    public BatchContents fetchBatchContents(BatchDescriptor batch) {
        URI uri = URI.create(resolveUrl(batch.storageRef()));
        String body;
        try {
            body = restClient.get().uri(uri).retrieve().body(String.class);
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            if (status == HttpStatus.TOO_MANY_REQUESTS.value() || e.getStatusCode().is5xxServerError()) {
                throw new TransientCollaboratorException("Storage returned " + status + " for " + uri, e);
            }
            if (status == HttpStatus.NOT_FOUND.value()) {
                throw new CollaboratorException("Contents of batch " + batch.batchId() + " not found at " + uri, e);
            }
            throw new CollaboratorException("Storage returned " + status + " for " + uri, e);
        } catch (ResourceAccessException e) {
            if (isInterruption(e)) {
                throw new VerificationCancelledException("Fetch of batch " + batch.batchId() + " interrupted", e);
            }
            throw new TransientCollaboratorException("Storage unreachable at " + uri + ": " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new CollaboratorException("Storage request failed for " + uri + ": " + e.getMessage(), e);
        }

        if (body == null || body.isBlank()) {
            throw new CollaboratorException("Empty contents for batch " + batch.batchId() + " at " + uri);
        }

        BatchContents contents;
        try {
            contents = objectMapper.readValue(body, BatchContents.class);
        } catch (JsonProcessingException e) {
            throw new CollaboratorException("Malformed contents for batch " + batch.batchId() + ": "
                    + e.getOriginalMessage(), e);
        }
        if (contents.batchId() != null && !contents.batchId().equals(batch.batchId())) {
            throw new CollaboratorException("Contents at " + uri + " belong to batch " + contents.batchId()
                    + ", expected " + batch.batchId());
        }
        log.debug("Fetched {} leaves for batch {} from {}", contents.leaves().size(), batch.batchId(), uri);
        return contents;
    }

    /**
     * Maps a storage reference to the URL it is fetched from.
     */
    public String resolveUrl(String storageRef) {
        if (storageRef == null || storageRef.isBlank()) {
            throw new CollaboratorException("Batch has no storage reference");
        }
        String ref = storageRef.trim();
        if (ref.startsWith("s3://")) {
            String rest = ref.substring("s3://".length());
            int slash = rest.indexOf('/');
            if (slash <= 0 || slash == rest.length() - 1) {
                throw new CollaboratorException("Malformed S3 reference: " + storageRef);
            }
            return "https://" + rest.substring(0, slash) + ".s3." + props.getRegion() + ".amazonaws.com/"
                    + rest.substring(slash + 1);
        }
        if (ref.startsWith("https://") || ref.startsWith("http://")) {
            return ref;
        }
        String base = props.getBaseUrl();
        if (base == null || base.isBlank()) {
            throw new CollaboratorException("storage.base-url is required to resolve key " + storageRef);
        }
        return stripTrailingSlash(base) + "/" + stripLeadingSlash(ref);
    }

    private static boolean isInterruption(Throwable e) {
        if (Thread.currentThread().isInterrupted()) return true;
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof InterruptedException) return true;
        }
        return false;
    }

    private static String stripTrailingSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }

    private static String stripLeadingSlash(String s) {
        return s.startsWith("/") ? s.substring(1) : s;
    }
}
