package infra.fetch;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;

/**
 * Downloads Census source files that are not yet present locally.
 *
 * <p>Single attempt per file, no retry. Failures are logged and reported through the return
 * value; the caller finds out later that the file is missing.</p>
 */
public class SourceFetcher {

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public SourceFetcher() {
        this(HttpClient.newBuilder()
                        .connectTimeout(Duration.ofSeconds(10))
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build(),
                Duration.ofMinutes(10));
    }

    public SourceFetcher(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
    }

    /**
     * @return true when the file exists afterwards
     */
    public boolean fetchIfMissing(String url, Path target) {
        if (Files.exists(target)) return true;

        System.out.println("[FETCH] Requesting file " + url);
        Path tmp = target.resolveSibling(target.getFileName() + ".part");
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(requestTimeout)
                    .GET()
                    .build();

            HttpResponse<Path> response = httpClient.send(request, HttpResponse.BodyHandlers.ofFile(tmp));
            if (response.statusCode() != 200) {
                System.out.println("[ERROR] Download from " + url + " failed. status=" + response.statusCode());
                Files.deleteIfExists(tmp);
                return false;
            }
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            System.out.println("[FETCH] File " + target + " downloaded successfully");
            return true;

        } catch (IOException e) {
            System.out.println("[ERROR] Download from " + url + " failed. reason=" + e);
            deleteQuietly(tmp);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.out.println("[ERROR] Download from " + url + " interrupted");
            deleteQuietly(tmp);
            return false;
        }
    }

    private static void deleteQuietly(Path p) {
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            System.out.println("[WARN] could not delete partial download " + p + ": " + e.getMessage());
        }
    }
}
