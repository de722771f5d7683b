package com.landrecords.ec.service;

import com.landrecords.ec.config.EcSearchProperties;
import com.landrecords.ec.model.District;
import com.landrecords.ec.model.Village;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HierarchyApiClientTest {

    private static final String BASE = "https://portal.test/api";

    private MockRestServiceServer server;
    private HierarchyApiClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        EcSearchProperties properties = new EcSearchProperties();
        properties.getApi().setBaseUrl(BASE);
        client = new HierarchyApiClient(restTemplate, properties);
    }

    @Test
    void dropsPlaceholderDistrict() {
        server.expect(requestTo(BASE + "/GetDistrictAsync"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess("""
                        [{"districtCode":0,"districtNamee":"Select"},
                         {"districtCode":2,"districtNamee":"Bengaluru Urban","districtNamek":"ಬೆಂಗಳೂರು ನಗರ"}]
                        """, MediaType.APPLICATION_JSON));

        List<District> districts = client.fetchDistricts();

        assertThat(districts).containsExactly(new District(2, "Bengaluru Urban", "ಬೆಂಗಳೂರು ನಗರ"));
    }

    @Test
    void villagesCarryParentAndUrbanFlag() {
        server.expect(requestTo(BASE + "/GetVillageAsync"))
                .andExpect(jsonPath("$.hobliCode").value("30"))
                .andRespond(withSuccess("""
                        [{"villagecode":40,"villagenamee":"Yadavanahalli","isurban":false},
                         {"villagecode":41,"villagenamee":"Anekal Town","isurban":true}]
                        """, MediaType.APPLICATION_JSON));

        List<Village> villages = client.fetchVillages(30);

        assertThat(villages).extracting(Village::hobliCode).containsOnly(30);
        assertThat(villages).extracting(Village::urban).containsExactly(false, true);
    }

    @Test
    void emptyListIsAFetchFailure() {
        server.expect(requestTo(BASE + "/GetHobliAsync")).andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.fetchHoblis(20)).isInstanceOf(FetchFailureException.class);
    }

    @Test
    void httpErrorIsAFetchFailure() {
        server.expect(requestTo(BASE + "/GetTalukaAsync")).andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));

        assertThatThrownBy(() -> client.fetchTalukas(2))
                .isInstanceOf(FetchFailureException.class)
                .hasMessageContaining("GetTalukaAsync");
    }
}
