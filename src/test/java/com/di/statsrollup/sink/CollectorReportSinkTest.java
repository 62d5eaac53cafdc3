package com.di.statsrollup.sink;

import com.di.statsrollup.config.RollupProperties;
import com.di.statsrollup.exception.SinkRejectedException;
import com.di.statsrollup.model.Report;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.net.ConnectException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * Test cases for CollectorReportSink.
 */
@DisplayName("CollectorReportSink Tests")
class CollectorReportSinkTest {

    private static final String URL = "http://collector.test:8787/cadvisor/metrics/";

    private MockRestServiceServer server;
    private CollectorReportSink sink;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();

        RollupProperties props = new RollupProperties();
        props.getSink().setUrl(URL);
        sink = new CollectorReportSink(builder, props, objectMapper);
    }

    private Report report() throws Exception {
        return new Report(1431034262L, 60, List.of(), objectMapper.readTree("{\"num_cores\":4}"));
    }

    @Test
    @DisplayName("Should POST the report as application/json")
    void testSend() throws Exception {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.timestamp").value(1431034262))
                .andExpect(jsonPath("$.interval").value(60))
                .andExpect(jsonPath("$.stats").isEmpty())
                .andExpect(jsonPath("$.machine.num_cores").value(4))
                .andRespond(withSuccess());

        sink.send(report());

        server.verify();
    }

    @Test
    @DisplayName("Non-success status should be a SinkRejected carrying the status")
    void testRejected() throws Exception {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        SinkRejectedException ex = assertThrows(SinkRejectedException.class, () -> sink.send(report()));
        assertEquals(503, ex.getStatusCode());
    }

    @Test
    @DisplayName("Client error status should be a SinkRejected too")
    void testBadRequest() throws Exception {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.BAD_REQUEST));

        SinkRejectedException ex = assertThrows(SinkRejectedException.class, () -> sink.send(report()));
        assertEquals(400, ex.getStatusCode());
    }

    @Test
    @DisplayName("Transport failure should be a SinkRejected without status")
    void testTransportFailure() throws Exception {
        server.expect(requestTo(URL)).andRespond(withException(new ConnectException("refused")));

        SinkRejectedException ex = assertThrows(SinkRejectedException.class, () -> sink.send(report()));
        assertEquals(-1, ex.getStatusCode());
    }
}
