package com.github.dimitryivaniuta.tutoring.web;

import com.github.dimitryivaniuta.tutoring.handler.ApiRequest;
import com.github.dimitryivaniuta.tutoring.handler.ApiResponse;
import com.github.dimitryivaniuta.tutoring.handler.CreateEngagementHandler;
import com.github.dimitryivaniuta.tutoring.handler.CreatePaymentHandler;
import com.github.dimitryivaniuta.tutoring.handler.RegisterStudentHandler;
import com.github.dimitryivaniuta.tutoring.handler.RequestHandler;
import com.github.dimitryivaniuta.tutoring.handler.SearchTutorsHandler;
import com.github.dimitryivaniuta.tutoring.handler.StudentEngagementsHandler;
import com.github.dimitryivaniuta.tutoring.handler.StudentPaymentsHandler;
import com.github.dimitryivaniuta.tutoring.handler.UpdateStudentHandler;
import jakarta.servlet.http.HttpServletResponse;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP adapter: turns requests on the API routes into {@link ApiRequest}s and handler responses back into
 * HTTP responses. Status, headers and body are passed through unchanged.
 *
 * <p>Headers already present on the servlet response win over the handler's. On a cross-origin request the
 * CORS processor has written {@code Access-Control-Allow-Origin} before the controller runs, and a second
 * value would make browsers reject the response.</p>
 */
@RestController
@RequestMapping("/api")
public class HandlerRoutesController {

    private final SearchTutorsHandler searchTutors;
    private final RegisterStudentHandler registerStudent;
    private final UpdateStudentHandler updateStudent;
    private final CreateEngagementHandler createEngagement;
    private final StudentEngagementsHandler studentEngagements;
    private final CreatePaymentHandler createPayment;
    private final StudentPaymentsHandler studentPayments;

    public HandlerRoutesController(
            SearchTutorsHandler searchTutors,
            RegisterStudentHandler registerStudent,
            UpdateStudentHandler updateStudent,
            CreateEngagementHandler createEngagement,
            StudentEngagementsHandler studentEngagements,
            CreatePaymentHandler createPayment,
            StudentPaymentsHandler studentPayments
    ) {
        this.searchTutors = searchTutors;
        this.registerStudent = registerStudent;
        this.updateStudent = updateStudent;
        this.createEngagement = createEngagement;
        this.studentEngagements = studentEngagements;
        this.createPayment = createPayment;
        this.studentPayments = studentPayments;
    }

    @RequestMapping(value = "/tutors", method = {RequestMethod.GET, RequestMethod.OPTIONS})
    public ResponseEntity<String> tutors(
            HttpMethod method,
            @RequestParam Map<String, String> query,
            HttpServletResponse servletResponse
    ) {
        return dispatch(searchTutors, new ApiRequest(method.name(), query, null), servletResponse);
    }

    @RequestMapping(value = "/students", method = {RequestMethod.POST, RequestMethod.PUT, RequestMethod.OPTIONS})
    public ResponseEntity<String> students(
            HttpMethod method,
            @RequestBody(required = false) String body,
            HttpServletResponse servletResponse
    ) {
        RequestHandler handler = HttpMethod.PUT.equals(method) ? updateStudent : registerStudent;
        return dispatch(handler, ApiRequest.withBody(method.name(), body), servletResponse);
    }

    @RequestMapping(value = "/engagements", method = {RequestMethod.GET, RequestMethod.POST, RequestMethod.OPTIONS})
    public ResponseEntity<String> engagements(
            HttpMethod method,
            @RequestParam Map<String, String> query,
            @RequestBody(required = false) String body,
            HttpServletResponse servletResponse
    ) {
        RequestHandler handler = HttpMethod.POST.equals(method) ? createEngagement : studentEngagements;
        return dispatch(handler, new ApiRequest(method.name(), query, body), servletResponse);
    }

    @RequestMapping(value = "/payments", method = {RequestMethod.GET, RequestMethod.POST, RequestMethod.OPTIONS})
    public ResponseEntity<String> payments(
            HttpMethod method,
            @RequestParam Map<String, String> query,
            @RequestBody(required = false) String body,
            HttpServletResponse servletResponse
    ) {
        RequestHandler handler = HttpMethod.POST.equals(method) ? createPayment : studentPayments;
        return dispatch(handler, new ApiRequest(method.name(), query, body), servletResponse);
    }

    private static ResponseEntity<String> dispatch(
            RequestHandler handler,
            ApiRequest request,
            HttpServletResponse servletResponse
    ) {
        ApiResponse response = handler.handle(request);
        HttpHeaders headers = new HttpHeaders();
        response.headers().forEach((name, value) -> {
            if (!servletResponse.containsHeader(name)) {
                headers.set(name, value);
            }
        });
        return ResponseEntity.status(response.statusCode()).headers(headers).body(response.body());
    }
}
