package personal.labs.core.acceptance.support;

import io.restassured.RestAssured;
import io.restassured.http.ContentType;
import io.restassured.response.Response;
import io.restassured.specification.RequestSpecification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.test.context.TestComponent;
import org.springframework.core.env.Environment;

import java.util.HashMap;
import java.util.Map;

/**
 * Lab Session HTTP Adapter
 * 인수 테스트용 순수 HTTP 클라이언트
 * Environment를 통해 런타임에 포트를 가져옴 (lazy initialization)
 */
@Slf4j
@TestComponent
public class LabHttpAdapter {

    private static final String BASE_URI = "http://localhost";
    private static final String AUTH_HEADER = "X-Auth-Token";

    private final Environment environment;

    public LabHttpAdapter(Environment environment) {
        this.environment = environment;
    }

    private int getPort() {
        return environment.getProperty("local.server.port", Integer.class, 8080);
    }

    private RequestSpecification givenRequest(String authToken) {
        return RestAssured.given()
                .baseUri(BASE_URI)
                .port(getPort())
                .contentType(ContentType.JSON)
                .header(AUTH_HEADER, authToken);
    }

    /**
     * 세션 생성/수정 요청 본문
     */
    public static Map<String, Object> slotBody(String topic, int level, int maxStudents,
                                               String startTime, String endTime) {
        Map<String, Object> body = new HashMap<>();
        body.put("level", level);
        body.put("date", "2026-03-02");
        body.put("startTime", startTime);
        body.put("endTime", endTime);
        body.put("topic", topic);
        body.put("description", "인수 테스트 세션");
        body.put("location", "3층 실습실");
        body.put("maxStudents", maxStudents);
        return body;
    }

    // ==========================================
    // 세션 API
    // ==========================================

    public Response createSlot(String authToken, Map<String, Object> body) {
        log.debug(">>> HTTP: POST /lab/slots - topic={}", body.get("topic"));
        return givenRequest(authToken).body(body).when().post("/api/v1/lab/slots");
    }

    public Response updateSlot(String authToken, Long slotId, Map<String, Object> body) {
        log.debug(">>> HTTP: PUT /lab/slots/{}", slotId);
        return givenRequest(authToken).body(body).when().put("/api/v1/lab/slots/{slotId}", slotId);
    }

    public Response changeStatus(String authToken, Long slotId, boolean active) {
        log.debug(">>> HTTP: PATCH /lab/slots/{}/status - active={}", slotId, active);
        return givenRequest(authToken)
                .body(Map.of("active", active))
                .when()
                .patch("/api/v1/lab/slots/{slotId}/status", slotId);
    }

    public Response deleteSlot(String authToken, Long slotId) {
        log.debug(">>> HTTP: DELETE /lab/slots/{}", slotId);
        return givenRequest(authToken).when().delete("/api/v1/lab/slots/{slotId}", slotId);
    }

    public Response getSlot(String authToken, Long slotId) {
        return givenRequest(authToken).when().get("/api/v1/lab/slots/{slotId}", slotId);
    }

    public Response getAvailableSlots(String authToken) {
        return givenRequest(authToken).when().get("/api/v1/lab/slots/available");
    }

    // ==========================================
    // 예약 API
    // ==========================================

    public Response createBooking(String authToken, Long slotId, String notes) {
        log.debug(">>> HTTP: POST /lab/bookings - slotId={}", slotId);
        Map<String, Object> body = new HashMap<>();
        body.put("slotId", slotId);
        body.put("notes", notes);
        return givenRequest(authToken).body(body).when().post("/api/v1/lab/bookings");
    }

    public Response cancelBooking(String authToken, Long bookingId) {
        log.debug(">>> HTTP: DELETE /lab/bookings/{}", bookingId);
        return givenRequest(authToken).when().delete("/api/v1/lab/bookings/{bookingId}", bookingId);
    }

    public Response getMyBookings(String authToken) {
        return givenRequest(authToken).when().get("/api/v1/lab/bookings/me");
    }

    public Response getRoster(String authToken, Long slotId) {
        return givenRequest(authToken).when().get("/api/v1/lab/slots/{slotId}/bookings", slotId);
    }
}
