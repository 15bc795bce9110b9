package de.ovgu.commitminer.analysis;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.ovgu.commitminer.util.Json;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.concurrent.TimeUnit;

/**
 * Sends analysis requests to a long-running PMD daemon over HTTP.  The request is a JSON object
 * <code>{path, ruleset, auxClasspath, files}</code>; the response body is a PMD JSON report.
 */
public class PmdDaemonAnalyzer implements Analyzer {
    private static final Logger LOG = Logger.getLogger(PmdDaemonAnalyzer.class);

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final String url;
    private final OkHttpClient httpClient;

    public PmdDaemonAnalyzer(String url, long timeoutMillis) {
        this.url = url;
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .callTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .build();
    }

    @Override
    public AnalysisReport analyze(AnalysisRequest analysisRequest) {
        if (analysisRequest.getFiles().isEmpty()) {
            return AnalysisReport.empty();
        }

        final byte[] payload;
        try {
            payload = Json.mapper().writeValueAsBytes(toJson(analysisRequest));
        } catch (IOException e) {
            throw new AnalysisException(AnalysisException.Cause.IO, "Failed to encode request for " + url, e);
        }
        Request request = new Request.Builder()
                .url(url)
                .post(RequestBody.create(payload, JSON))
                .build();

        LOG.debug("Sending " + analysisRequest + " to " + url);
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful()) {
                String errorBody = body != null ? body.string() : "(no body)";
                throw new AnalysisException(AnalysisException.Cause.SERVER,
                        "PMD daemon at " + url + " failed: " + response.code() + " - " + StringUtils.abbreviate(errorBody, 500));
            }
            if (body == null) {
                throw new AnalysisException(AnalysisException.Cause.REPORT, "Empty response from PMD daemon at " + url);
            }
            return new PmdReportParser(analysisRequest.getRoot()).parse(body.bytes());
        } catch (InterruptedIOException e) {
            throw new AnalysisException(AnalysisException.Cause.TIMEOUT, "PMD daemon at " + url + " timed out", e);
        } catch (IOException e) {
            throw new AnalysisException(AnalysisException.Cause.TRANSPORT,
                    "Error talking to PMD daemon at " + url + ": " + e.getMessage(), e, true);
        }
    }

    static ObjectNode toJson(AnalysisRequest analysisRequest) {
        ObjectNode node = Json.mapper().createObjectNode();
        node.put("path", analysisRequest.getRoot().getAbsolutePath());
        node.put("ruleset", analysisRequest.getRuleset().getAbsolutePath());
        node.put("auxClasspath", analysisRequest.getAuxClasspath());
        ArrayNode files = node.putArray("files");
        for (String f : analysisRequest.getFiles()) {
            files.add(f);
        }
        return node;
    }
}
