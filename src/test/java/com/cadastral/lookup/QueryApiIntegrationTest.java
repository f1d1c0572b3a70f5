package com.cadastral.lookup;

import com.cadastral.lookup.api.dto.QueryRequestDto;
import com.cadastral.lookup.application.port.out.QueryHistoryRepository;
import com.cadastral.lookup.domain.model.User;
import com.cadastral.lookup.infrastructure.external.TestResolverConfig;
import com.cadastral.lookup.module.test.support.FakeCadastralResolver;
import com.cadastral.lookup.module.test.support.TestDataBuilder;
import com.cadastral.lookup.module.test.support.TestFixtures;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;

import static com.cadastral.lookup.module.test.support.TestFixtures.CadastralNumbers;
import static com.cadastral.lookup.module.test.support.TestFixtures.Common;
import static com.cadastral.lookup.module.test.support.TestFixtures.Coordinates;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(TestResolverConfig.class)
@Transactional
class QueryApiIntegrationTest {

        @Autowired
        private MockMvc mockMvc;

        @Autowired
        private ObjectMapper objectMapper;

        @Autowired
        private QueryHistoryRepository queryHistoryRepository;

        @Autowired
        private TestDataBuilder testData;

        @Autowired
        private FakeCadastralResolver resolver;

        private User owner;
        private String ownerToken;

        @BeforeEach
        void setUp() {
                resolver.reset();
                owner = testData.user(Common.OWNER_EMAIL);
                ownerToken = testData.bearer(owner);
        }

        private ResultActions submit(String token, QueryRequestDto request) throws Exception {
                return mockMvc.perform(post("/query")
                                .header("Authorization", token)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(objectMapper.writeValueAsString(request)));
        }

        @Test
        void testQuery_ValidNumberWithCoordinates_RecordsResult() throws Exception {
                resolver.answering(true);

                submit(ownerToken, TestFixtures.queryRequest(CadastralNumbers.PRIMARY,
                                Coordinates.MOSCOW_LAT, Coordinates.MOSCOW_LNG))
                                .andExpect(status().isOk())
                                .andExpect(jsonPath("$.id").isNumber())
                                .andExpect(jsonPath("$.cadastralNumber").value(CadastralNumbers.PRIMARY))
                                .andExpect(jsonPath("$.latitude").value(55.7558))
                                .andExpect(jsonPath("$.longitude").value(37.6176))
                                .andExpect(jsonPath("$.result").value(true))
                                .andExpect(jsonPath("$.createdAt").exists());

                assertThat(queryHistoryRepository.countByUserId(owner.getId())).isEqualTo(1);
                assertThat(resolver.getCalls()).hasSize(1);
                assertThat(resolver.getCalls().get(0).getAuthorization()).isEqualTo(ownerToken);
        }

        @Test
        void testQuery_ResponseCarriesStoredScale() throws Exception {
                String posted = submit(ownerToken, TestFixtures.queryRequest(CadastralNumbers.PRIMARY,
                                new BigDecimal("55.7558"), new BigDecimal("37.6176")))
                                .andExpect(status().isOk())
                                .andReturn()
                                .getResponse()
                                .getContentAsString();

                // NUMERIC(8,6) and NUMERIC(9,6) columns
                assertThat(posted).contains("\"latitude\":55.755800").contains("\"longitude\":37.617600");
        }

        @Test
        void testQuery_WithoutCoordinates_NullsInResponse() throws Exception {
                resolver.answering(false);

                submit(ownerToken, TestFixtures.queryRequest(CadastralNumbers.SEVEN_DIGIT_BLOCK))
                                .andExpect(status().isOk())
                                .andExpect(jsonPath("$.latitude").value(nullValue()))
                                .andExpect(jsonPath("$.longitude").value(nullValue()))
                                .andExpect(jsonPath("$.result").value(false));
        }

        @Test
        void testQuery_ResolverUnavailable_RecordsFalse() throws Exception {
                resolver.unavailable();

                submit(ownerToken, TestFixtures.queryRequest(CadastralNumbers.PRIMARY))
                                .andExpect(status().isOk())
                                .andExpect(jsonPath("$.result").value(false));

                assertThat(queryHistoryRepository.countByUserId(owner.getId())).isEqualTo(1);
        }

        @Test
        void testQuery_MalformedNumber_Returns400AndNothingStored() throws Exception {
                submit(ownerToken, TestFixtures.queryRequest("12-34-567890-1011"))
                                .andExpect(status().isBadRequest())
                                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
                                .andExpect(jsonPath("$.fieldErrors.cadastralNumber").exists());

                assertThat(queryHistoryRepository.countByUserId(owner.getId())).isZero();
                assertThat(resolver.getCalls()).isEmpty();
        }

        @Test
        void testQuery_LatitudeOutOfRange_Returns400() throws Exception {
                submit(ownerToken, TestFixtures.queryRequest(CadastralNumbers.PRIMARY,
                                new BigDecimal("90"), Coordinates.MOSCOW_LNG))
                                .andExpect(status().isBadRequest())
                                .andExpect(jsonPath("$.fieldErrors.latitude").exists());
        }

        @Test
        void testQuery_LatitudeLowerBound_Returns400() throws Exception {
                submit(ownerToken, TestFixtures.queryRequest(CadastralNumbers.PRIMARY,
                                new BigDecimal("-90"), Coordinates.MOSCOW_LNG))
                                .andExpect(status().isBadRequest())
                                .andExpect(jsonPath("$.fieldErrors.latitude").exists());

                submit(ownerToken, TestFixtures.queryRequest(CadastralNumbers.PRIMARY,
                                new BigDecimal("-89.999999"), Coordinates.MOSCOW_LNG))
                                .andExpect(status().isOk());
        }

        @Test
        void testQuery_LongitudeOutOfRange_Returns400() throws Exception {
                submit(ownerToken, TestFixtures.queryRequest(CadastralNumbers.PRIMARY,
                                Coordinates.MOSCOW_LAT, new BigDecimal("180.5")))
                                .andExpect(status().isBadRequest())
                                .andExpect(jsonPath("$.fieldErrors.longitude").exists());
        }

        @Test
        void testQuery_MalformedJson_Returns400() throws Exception {
                mockMvc.perform(post("/query")
                                .header("Authorization", ownerToken)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("{\"cadastralNumber\": "))
                                .andExpect(status().isBadRequest());
        }

        @Test
        void testQuery_NoToken_Returns401() throws Exception {
                mockMvc.perform(post("/query")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(objectMapper.writeValueAsString(
                                                TestFixtures.queryRequest(CadastralNumbers.PRIMARY))))
                                .andExpect(status().isUnauthorized())
                                .andExpect(header().exists("WWW-Authenticate"))
                                .andExpect(jsonPath("$.error").value("UNAUTHORIZED"));

                assertThat(resolver.getCalls()).isEmpty();
        }

        @Test
        void testQuery_InvalidToken_Returns401() throws Exception {
                submit("Bearer not-a-real-token", TestFixtures.queryRequest(CadastralNumbers.PRIMARY))
                                .andExpect(status().isUnauthorized());
        }

        @Test
        void testHistory_NewestFirst() throws Exception {
                testData.history(owner, CadastralNumbers.PRIMARY, CadastralNumbers.SECONDARY, CadastralNumbers.TERTIARY);

                mockMvc.perform(get("/history").header("Authorization", ownerToken))
                                .andExpect(status().isOk())
                                .andExpect(jsonPath("$", hasSize(3)))
                                .andExpect(jsonPath("$[0].cadastralNumber").value(CadastralNumbers.TERTIARY))
                                .andExpect(jsonPath("$[1].cadastralNumber").value(CadastralNumbers.SECONDARY))
                                .andExpect(jsonPath("$[2].cadastralNumber").value(CadastralNumbers.PRIMARY));
        }

        @Test
        void testHistory_FilterByNumber() throws Exception {
                testData.history(owner, CadastralNumbers.PRIMARY, CadastralNumbers.SECONDARY, CadastralNumbers.PRIMARY);

                mockMvc.perform(get("/history")
                                .param("cadastralNumber", CadastralNumbers.PRIMARY)
                                .header("Authorization", ownerToken))
                                .andExpect(status().isOk())
                                .andExpect(jsonPath("$", hasSize(2)))
                                .andExpect(jsonPath("$[0].cadastralNumber").value(CadastralNumbers.PRIMARY))
                                .andExpect(jsonPath("$[1].cadastralNumber").value(CadastralNumbers.PRIMARY));
        }

        @Test
        void testHistory_Pagination() throws Exception {
                testData.history(owner, CadastralNumbers.PRIMARY, CadastralNumbers.SECONDARY, CadastralNumbers.TERTIARY);

                mockMvc.perform(get("/history").param("page", "2").param("size", "2")
                                .header("Authorization", ownerToken))
                                .andExpect(status().isOk())
                                .andExpect(jsonPath("$", hasSize(1)))
                                .andExpect(jsonPath("$[0].cadastralNumber").value(CadastralNumbers.PRIMARY));

                mockMvc.perform(get("/history").param("page", "3").param("size", "2")
                                .header("Authorization", ownerToken))
                                .andExpect(status().isNotFound())
                                .andExpect(jsonPath("$.detail").value("no records found"));
        }

        @Test
        void testHistory_FourRowsSizeThree_ReturnsThree() throws Exception {
                testData.history(owner, CadastralNumbers.PRIMARY, CadastralNumbers.SECONDARY,
                                CadastralNumbers.TERTIARY, CadastralNumbers.SEVEN_DIGIT_BLOCK);

                mockMvc.perform(get("/history").param("page", "1").param("size", "3")
                                .header("Authorization", ownerToken))
                                .andExpect(status().isOk())
                                .andExpect(jsonPath("$", hasSize(3)))
                                .andExpect(jsonPath("$[0].cadastralNumber").value(CadastralNumbers.SEVEN_DIGIT_BLOCK));
        }

        @Test
        void testHistory_HugePageNumber_Returns404() throws Exception {
                testData.history(owner, CadastralNumbers.PRIMARY);

                mockMvc.perform(get("/history").param("page", "30000000").param("size", "100")
                                .header("Authorization", ownerToken))
                                .andExpect(status().isNotFound())
                                .andExpect(jsonPath("$.error").value("NOT_FOUND"))
                                .andExpect(jsonPath("$.detail").value("no records found"));
        }

        @Test
        void testHistory_UnknownNumber_Returns404() throws Exception {
                testData.history(owner, CadastralNumbers.PRIMARY);

                mockMvc.perform(get("/history")
                                .param("cadastralNumber", CadastralNumbers.UNUSED)
                                .header("Authorization", ownerToken))
                                .andExpect(status().isNotFound())
                                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
        }

        @Test
        void testHistory_MalformedFilter_Returns400() throws Exception {
                mockMvc.perform(get("/history")
                                .param("cadastralNumber", "abc")
                                .header("Authorization", ownerToken))
                                .andExpect(status().isBadRequest())
                                .andExpect(jsonPath("$.error").value("INVALID_CADASTRAL_NUMBER"));
        }

        @Test
        void testHistory_ScopedToCaller() throws Exception {
                User other = testData.user(Common.OTHER_EMAIL);
                testData.history(other, CadastralNumbers.SECONDARY);
                testData.history(owner, CadastralNumbers.PRIMARY);

                mockMvc.perform(get("/history").header("Authorization", ownerToken))
                                .andExpect(status().isOk())
                                .andExpect(jsonPath("$", hasSize(1)))
                                .andExpect(jsonPath("$[0].cadastralNumber").value(CadastralNumbers.PRIMARY));

                mockMvc.perform(get("/history")
                                .param("cadastralNumber", CadastralNumbers.SECONDARY)
                                .header("Authorization", ownerToken))
                                .andExpect(status().isNotFound());
        }

        @Test
        void testHistory_SizeTooLarge_Returns400() throws Exception {
                mockMvc.perform(get("/history").param("size", "101").header("Authorization", ownerToken))
                                .andExpect(status().isBadRequest());
        }

        @Test
        void testHistory_PageZero_Returns400() throws Exception {
                mockMvc.perform(get("/history").param("page", "0").header("Authorization", ownerToken))
                                .andExpect(status().isBadRequest());
        }

        @Test
        void testHistory_NonNumericPage_Returns400() throws Exception {
                mockMvc.perform(get("/history").param("page", "first").header("Authorization", ownerToken))
                                .andExpect(status().isBadRequest())
                                .andExpect(jsonPath("$.error").value("INVALID_PARAMETER"));
        }

        @Test
        void testHistory_NoToken_Returns401() throws Exception {
                mockMvc.perform(get("/history"))
                                .andExpect(status().isUnauthorized());
        }

        @Test
        void testPing_IsPublic() throws Exception {
                mockMvc.perform(get("/ping"))
                                .andExpect(status().isOk())
                                .andExpect(jsonPath("$.message").value("Server is running"));
        }
}
