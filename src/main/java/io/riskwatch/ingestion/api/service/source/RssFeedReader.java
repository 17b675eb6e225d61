package io.riskwatch.ingestion.api.service.source;

import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import io.riskwatch.ingestion.api.exception.ErrorCategory;
import io.riskwatch.ingestion.api.exception.SourceFetchException;
import io.riskwatch.ingestion.api.exception.TransientSourceException;
import io.riskwatch.ingestion.config.HttpConfig;
import io.riskwatch.ingestion.config.IngestionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.net.ConnectException;
import java.net.HttpURLConnection;
import java.net.MalformedURLException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.URL;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.zip.GZIPInputStream;

@Service
public class RssFeedReader {

    private static final Logger logger = LoggerFactory.getLogger(RssFeedReader.class);

    private final AtomicInteger userAgentIndex = new AtomicInteger();
    private final HttpConfig http;

    @Autowired
    public RssFeedReader(IngestionConfig config) {
        this(config.http());
    }

    public RssFeedReader(HttpConfig http) {
        this.http = http;
    }

    /**
     * Fetches and parses one feed. Transient failures are retried with exponential backoff;
     * the last failure propagates with its category.
     *
     * @param url      feed URL
     * @param category section code attached to every entry
     */
    @Retryable(
            retryFor = TransientSourceException.class,
            maxAttemptsExpression = "#{@ingestionProps.maxAttempts}",
            backoff = @Backoff(delayExpression = "#{@ingestionProps.retryDelay}", multiplier = 2.0, maxDelay = 10000)
    )
    public List<FeedEntry> read(String url, String category) throws SourceFetchException {
        HttpURLConnection connection = null;

        try {
            if (url == null || url.trim().isEmpty()) {
                throw SourceFetchException.of("URL is null or empty", ErrorCategory.INVALID_URL);
            }

            logger.debug("Reading feed {}", url);
            connection = (HttpURLConnection) new URL(url).openConnection();
            configureConnection(connection);
            connection.connect();

            validateHttpResponse(connection, url);

            return parseFeed(connection, category);

        } catch (MalformedURLException e) {
            throw SourceFetchException.of("Invalid URL format: " + url, e, ErrorCategory.INVALID_URL);

        } catch (SocketTimeoutException e) {
            throw SourceFetchException.of("Connection timeout for: " + url, e, ErrorCategory.TIMEOUT);

        } catch (ConnectException e) {
            throw SourceFetchException.of("Connection refused: " + url, e, ErrorCategory.CONNECTION_REFUSED);

        } catch (UnknownHostException e) {
            throw SourceFetchException.of("Unknown host: " + url, e, ErrorCategory.DNS_ERROR);

        } catch (SocketException e) {
            throw SourceFetchException.of("Network error: " + url, e, ErrorCategory.NETWORK_ERROR);

        } catch (IOException e) {
            throw SourceFetchException.of("I/O error reading: " + url, e, ErrorCategory.IO_ERROR);

        } finally {
            if (connection != null) {
                connection.disconnect();
            }
        }
    }

    private void configureConnection(HttpURLConnection connection) {
        connection.setConnectTimeout(http.connectTimeout());
        connection.setReadTimeout(http.readTimeout());

        connection.setRequestProperty("User-Agent", nextUserAgent());
        connection.setRequestProperty("Accept", "application/rss+xml, application/atom+xml, application/xml, text/xml, */*");
        connection.setRequestProperty("Accept-Language", "es-ES,es;q=0.9,en;q=0.8");
        connection.setRequestProperty("Accept-Encoding", "gzip");
        connection.setRequestProperty("Cache-Control", "no-cache");

        connection.setInstanceFollowRedirects(true);
        connection.setUseCaches(false);
    }

    private void validateHttpResponse(HttpURLConnection connection, String url) throws IOException, SourceFetchException {
        int responseCode = connection.getResponseCode();

        switch (responseCode) {
            case HttpURLConnection.HTTP_OK:
                String contentType = connection.getContentType();
                if (contentType != null && !isFeedContentType(contentType)) {
                    logger.warn("Unexpected content type for {}: {}", url, contentType);
                }
                break;

            case HttpURLConnection.HTTP_NOT_FOUND:
                throw SourceFetchException.of("Feed not found (404): " + url, ErrorCategory.NOT_FOUND);

            case HttpURLConnection.HTTP_FORBIDDEN:
                throw SourceFetchException.of("Access forbidden (403): " + url, ErrorCategory.ACCESS_FORBIDDEN);

            case HttpURLConnection.HTTP_UNAUTHORIZED:
                throw SourceFetchException.of("Authentication required (401): " + url, ErrorCategory.AUTH_REQUIRED);

            case 429:
                throw SourceFetchException.of("Rate limited (429): " + url, ErrorCategory.RATE_LIMITED);

            case HttpURLConnection.HTTP_INTERNAL_ERROR:
                throw SourceFetchException.of("Server error (500): " + url, ErrorCategory.SERVER_ERROR);

            case HttpURLConnection.HTTP_BAD_GATEWAY:
            case HttpURLConnection.HTTP_UNAVAILABLE:
            case HttpURLConnection.HTTP_GATEWAY_TIMEOUT:
                throw SourceFetchException.of("Server temporarily unavailable (" + responseCode + "): " + url,
                        ErrorCategory.SERVER_UNAVAILABLE);

            default:
                if (responseCode >= 400) {
                    throw SourceFetchException.of(
                            String.format("HTTP error %d (%s): %s", responseCode, connection.getResponseMessage(), url),
                            ErrorCategory.HTTP_ERROR);
                }
        }
    }

    private List<FeedEntry> parseFeed(HttpURLConnection connection, String category) throws IOException, SourceFetchException {
        InputStream inputStream = connection.getInputStream();
        if ("gzip".equalsIgnoreCase(connection.getContentEncoding())) {
            inputStream = new GZIPInputStream(inputStream);
        }

        String xmlContent;
        try (InputStream in = inputStream) {
            xmlContent = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }

        SyndFeed feed;
        try {
            feed = new SyndFeedInput().build(new StringReader(xmlContent));
        } catch (FeedException | IllegalArgumentException e) {
            throw SourceFetchException.of("Feed parsing error: " + e.getMessage(), e, ErrorCategory.PARSE_ERROR);
        }

        if (feed.getEntries() == null || feed.getEntries().isEmpty()) {
            logger.debug("Feed {} has no entries", connection.getURL());
            return Collections.emptyList();
        }

        return feed.getEntries().stream()
                .map(entry -> toEntry(entry, category))
                .filter(Objects::nonNull)
                .toList();
    }

    private FeedEntry toEntry(SyndEntry entry, String category) {
        String title = entry.getTitle() != null ? cleanText(entry.getTitle()) : "";
        String link = entry.getLink() != null ? entry.getLink().trim() : "";

        if (title.isBlank() || link.isBlank()) {
            logger.debug("Skipping entry with missing title or link: title='{}', link='{}'", title, link);
            return null;
        }

        String description = entry.getDescription() != null ? cleanText(entry.getDescription().getValue()) : "";
        String author = entry.getAuthor() != null ? cleanText(entry.getAuthor()) : null;
        var published = entry.getPublishedDate() != null ? entry.getPublishedDate() : entry.getUpdatedDate();

        return new FeedEntry(title, link, description, author,
                published != null ? published.toInstant() : null, category);
    }

    private String nextUserAgent() {
        List<String> userAgents = http.userAgents();
        if (userAgents == null || userAgents.isEmpty()) {
            return "RiskWatch/1.0";
        }
        return userAgents.get(Math.floorMod(userAgentIndex.getAndIncrement(), userAgents.size()));
    }

    private boolean isFeedContentType(String contentType) {
        String lower = contentType.toLowerCase();
        return lower.contains("xml") || lower.contains("rss") || lower.contains("atom") || lower.contains("text");
    }

    static String cleanText(String text) {
        if (text == null) return "";

        return text
                .replaceAll("<[^>]+>", " ")          // tags
                .replaceAll("&[a-zA-Z0-9#]+;", " ")  // entities
                .replaceAll("\\s+", " ")
                .trim();
    }
}
