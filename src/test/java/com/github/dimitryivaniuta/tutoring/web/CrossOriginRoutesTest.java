package com.github.dimitryivaniuta.tutoring.web;

import com.github.dimitryivaniuta.tutoring.handler.ApiResponse;
import com.github.dimitryivaniuta.tutoring.handler.CreateEngagementHandler;
import com.github.dimitryivaniuta.tutoring.handler.CreatePaymentHandler;
import com.github.dimitryivaniuta.tutoring.handler.RegisterStudentHandler;
import com.github.dimitryivaniuta.tutoring.handler.SearchTutorsHandler;
import com.github.dimitryivaniuta.tutoring.handler.StudentEngagementsHandler;
import com.github.dimitryivaniuta.tutoring.handler.StudentPaymentsHandler;
import com.github.dimitryivaniuta.tutoring.handler.UpdateStudentHandler;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;
import org.springframework.test.web.servlet.result.MockMvcResultMatchers;

/**
 * CORS headers as a browser sees them, with the MVC CORS configuration in place.
 */
@WebMvcTest(HandlerRoutesController.class)
class CrossOriginRoutesTest {

    private static final String ORIGIN = "http://app.example";

    @Autowired
    private MockMvc mvc;

    @MockBean
    private SearchTutorsHandler searchTutors;
    @MockBean
    private RegisterStudentHandler registerStudent;
    @MockBean
    private UpdateStudentHandler updateStudent;
    @MockBean
    private CreateEngagementHandler createEngagement;
    @MockBean
    private StudentEngagementsHandler studentEngagements;
    @MockBean
    private CreatePaymentHandler createPayment;
    @MockBean
    private StudentPaymentsHandler studentPayments;

    @BeforeEach
    void setUp() {
        Mockito.when(searchTutors.handle(Mockito.any())).thenReturn(new ApiResponse(200, Map.of(
                "Access-Control-Allow-Origin", "*",
                "Access-Control-Allow-Methods", "OPTIONS, GET",
                "Access-Control-Allow-Headers", "Content-Type",
                "Content-Type", "application/json"), "[]"));
    }

    @Test
    void crossOriginRequestCarriesASingleAllowOrigin() throws Exception {
        mvc.perform(MockMvcRequestBuilders.get("/api/tutors").header(HttpHeaders.ORIGIN, ORIGIN))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.header().stringValues("Access-Control-Allow-Origin", ORIGIN))
                .andExpect(MockMvcResultMatchers.header().string("Content-Type", "application/json"))
                .andExpect(MockMvcResultMatchers.content().string("[]"));
    }

    @Test
    void sameOriginRequestKeepsHandlerHeaders() throws Exception {
        mvc.perform(MockMvcRequestBuilders.get("/api/tutors"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.header().stringValues("Access-Control-Allow-Origin", "*"))
                .andExpect(MockMvcResultMatchers.header().string("Access-Control-Allow-Methods", "OPTIONS, GET"));
    }

    @Test
    void browserPreflightIsAnsweredWithoutReachingHandlers() throws Exception {
        mvc.perform(MockMvcRequestBuilders.options("/api/payments")
                        .header(HttpHeaders.ORIGIN, ORIGIN)
                        .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "POST"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.header().stringValues("Access-Control-Allow-Origin", ORIGIN));

        Mockito.verifyNoInteractions(createPayment, studentPayments);
    }
}
