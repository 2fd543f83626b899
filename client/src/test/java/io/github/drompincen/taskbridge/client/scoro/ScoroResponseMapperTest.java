package io.github.drompincen.taskbridge.client.scoro;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.taskbridge.protocol.api.PhaseType;
import io.github.drompincen.taskbridge.protocol.remote.RemoteCompany;
import io.github.drompincen.taskbridge.protocol.remote.RemotePhase;
import io.github.drompincen.taskbridge.protocol.remote.RemoteUser;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScoroResponseMapperTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    @Test
    void itemsReadsBareArrayOrNamedCollection() throws Exception {
        assertThat(ScoroResponseMapper.items(json("{\"data\":[{\"id\":1},{\"id\":2}]}"))).hasSize(2);
        assertThat(ScoroResponseMapper.items(json("{\"data\":{\"companies\":[{\"id\":1}]}}"), "contacts", "companies"))
                .hasSize(1);
        assertThat(ScoroResponseMapper.items(json("{\"data\":{}}"), "users")).isEmpty();
    }

    @Test
    void errorMessageJoinsAllErrors() throws Exception {
        JsonNode response = json("{\"status\":\"ERROR\",\"messages\":{\"error\":[\"Bad owner\",\"Bad project\"]}}");

        assertThat(ScoroResponseMapper.isError(response)).isTrue();
        assertThat(ScoroResponseMapper.errorMessage(response)).isEqualTo("Bad owner; Bad project");
        assertThat(ScoroResponseMapper.errorMessage(json("{\"status\":\"ERROR\"}"))).isEqualTo("Unknown error");
    }

    @Test
    void idAcceptsNumbersAndNumericStrings() throws Exception {
        assertThat(ScoroResponseMapper.id(json("{\"event_id\":\"41\"}"), "event_id")).isEqualTo(41);
        assertThat(ScoroResponseMapper.id(json("{\"id\":12}"), "event_id", "id")).isEqualTo(12);
        assertThat(ScoroResponseMapper.id(json("{\"id\":\"n/a\"}"), "id")).isNull();
    }

    @Test
    void userActiveFlagAcceptsBooleanAndNumericString() throws Exception {
        RemoteUser active = ScoroResponseMapper.user(json(
                "{\"id\":3,\"firstname\":\"Jane\",\"lastname\":\"Doe\",\"full_name\":\"Jane Doe\",\"is_active\":\"1\"}"));
        RemoteUser inactive = ScoroResponseMapper.user(json("{\"id\":4,\"full_name\":\"Old Timer\",\"is_active\":false}"));

        assertThat(active.active()).isTrue();
        assertThat(active.firstName()).isEqualTo("Jane");
        assertThat(inactive.active()).isFalse();
    }

    @Test
    void phaseSkipsZeroDates() throws Exception {
        RemotePhase phase = ScoroResponseMapper.phase(json(
                "{\"id\":\"9\",\"project_id\":104,\"type\":\"milestone\",\"title\":\"Launch\","
                        + "\"start_date\":\"0000-00-00\",\"end_date\":\"2024-05-01\"}"));

        assertThat(phase.id()).isEqualTo(9);
        assertThat(phase.projectId()).isEqualTo(104);
        assertThat(phase.type()).isEqualTo(PhaseType.MILESTONE);
        assertThat(phase.startDate()).isNull();
        assertThat(phase.endDate()).isEqualTo(LocalDate.of(2024, 5, 1));
    }

    @Test
    void companyIdFallsBackAcrossFieldNames() throws Exception {
        RemoteCompany company = ScoroResponseMapper.company(json("{\"client_id\":55,\"company_name\":\"Acme\"}"));

        assertThat(company.id()).isEqualTo(55);
        assertThat(company.name()).isEqualTo("Acme");
        assertThatThrownBy(() -> ScoroResponseMapper.company(json("{\"name\":\"No Id\"}")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
