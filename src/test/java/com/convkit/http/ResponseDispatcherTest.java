package com.convkit.http;

import com.convkit.model.Counterexample;
import com.convkit.model.Workspace;
import com.convkit.shared.error.DecodeException;
import com.convkit.shared.error.ServiceException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseDispatcherTest {

    private final ResponseDispatcher dispatcher = new ResponseDispatcher();

    @Test
    void notFoundCarriesServiceMessage() {
        var outcome = dispatcher.dispatch(new RawResponse(404, "{\"error\":\"not found\"}"), Workspace.SCHEMA);

        assertThat(outcome).isInstanceOf(Outcome.Failure.class);
        var error = (ServiceException) ((Outcome.Failure<Workspace>) outcome).error();
        assertThat(error.statusCode()).isEqualTo(404);
        assertThat(error.serviceMessage()).contains("not found");
        assertThat(error).hasMessage("Service error 404: not found");
    }

    @Test
    void createdDecodesBody() {
        var body = "{\"text\":\"taxi\",\"created\":\"2017-05-26T10:00:00Z\",\"updated\":\"2017-05-26T10:00:00Z\"}";
        var outcome = dispatcher.dispatch(new RawResponse(201, body), Counterexample.SCHEMA);

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.get().text()).isEqualTo("taxi");
    }

    @Test
    void noContentIsEmptySuccess() {
        var outcome = dispatcher.dispatch(new RawResponse(204, ""), null);
        assertThat(outcome).isInstanceOf(Outcome.EmptySuccess.class);
    }

    @Test
    void emptyBodyWhereRecordExpectedFailsOnGet() {
        var outcome = dispatcher.dispatch(new RawResponse(200, "  \n"), Workspace.SCHEMA);
        assertThat(outcome).isInstanceOf(Outcome.EmptySuccess.class);
        assertThatThrownBy(outcome::get)
                .isInstanceOf(DecodeException.class)
                .extracting(e -> ((DecodeException) e).kind())
                .isEqualTo(DecodeException.Kind.EMPTY_BODY);
    }

    @Test
    void unparsableErrorBodyGivesStatusOnly() {
        var outcome = dispatcher.dispatch(new RawResponse(502, "<html>Bad Gateway</html>"), Workspace.SCHEMA);
        var error = (ServiceException) ((Outcome.Failure<Workspace>) outcome).error();
        assertThat(error.statusCode()).isEqualTo(502);
        assertThat(error.serviceMessage()).isEmpty();
        assertThat(error).hasMessage("Service error 502");
    }

    @Test
    void fallsBackToMessageKey() {
        var error = dispatcher.toServiceError(new RawResponse(400, "{\"message\":\"bad version\",\"code\":400}"));
        assertThat(error.serviceMessage()).contains("bad version");
    }

    @Test
    void missingErrorBodyGivesStatusOnly() {
        var error = dispatcher.toServiceError(new RawResponse(500, (String) null));
        assertThat(error.serviceMessage()).isEmpty();
    }

    @Test
    void invalidSuccessBodyIsDecodeFailure() {
        var outcome = dispatcher.dispatch(new RawResponse(200, "{\"name\":\"x\"}"), Workspace.SCHEMA);
        assertThat(outcome.isSuccess()).isFalse();
        assertThatThrownBy(outcome::get)
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("Workspace.language");
    }
}
