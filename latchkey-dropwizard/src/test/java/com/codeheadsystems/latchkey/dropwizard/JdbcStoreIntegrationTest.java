package com.codeheadsystems.latchkey.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.latchkey.model.LoginRequest;
import com.codeheadsystems.latchkey.model.LoginResponse;
import com.codeheadsystems.latchkey.model.LogoutResponse;
import com.codeheadsystems.latchkey.model.SessionResponse;
import com.codeheadsystems.latchkey.model.SignupRequest;
import com.codeheadsystems.latchkey.model.TokenRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Runs the bundle against a configured database with revocation disabled.
 */
@ExtendWith(DropwizardExtensionsSupport.class)
class JdbcStoreIntegrationTest {

  static final DropwizardAppExtension<LatchkeyConfiguration> APP =
      new DropwizardAppExtension<>(
          LatchkeyTestApplication.class,
          ResourceHelpers.resourceFilePath("test-config-h2.yml"));

  private final ObjectMapper mapper = new ObjectMapper();
  private final HttpClient httpClient = HttpClient.newHttpClient();

  @Test
  void accountsAreStoredInTheDatabase() throws Exception {
    assertThat(post("/auth/signup",
        new SignupRequest("Heidi", "Str0ngP@ss", "PET_NAME", "Rex")).statusCode()).isEqualTo(200);

    try (Connection connection = DriverManager.getConnection(
        "jdbc:h2:mem:latchkey-dropwizard;DB_CLOSE_DELAY=-1", "sa", "");
         PreparedStatement statement = connection.prepareStatement(
             "SELECT username, security_question FROM latchkey_account WHERE username_key = ?")) {
      statement.setString(1, "heidi");
      try (ResultSet rs = statement.executeQuery()) {
        assertThat(rs.next()).isTrue();
        assertThat(rs.getString("username")).isEqualTo("Heidi");
        assertThat(rs.getString("security_question")).isEqualTo("PET_NAME");
      }
    }
  }

  @Test
  void logoutWithoutRevocation_asksClientToDiscard() throws Exception {
    post("/auth/signup", new SignupRequest("ivan", "Str0ngP@ss", "FIRST_CAR", "Lada"));
    HttpResponse<String> login = post("/auth/login", new LoginRequest("ivan", "Str0ngP@ss"));
    String token = mapper.readValue(login.body(), LoginResponse.class).token();

    LogoutResponse logout = mapper.readValue(post("/auth/logout", new TokenRequest(token)).body(),
        LogoutResponse.class);

    assertThat(logout.mode()).isEqualTo("CLIENT_DISCARD");
    HttpResponse<String> validate = post("/auth/session/validate", new TokenRequest(token));
    assertThat(validate.statusCode()).isEqualTo(200);
    assertThat(mapper.readValue(validate.body(), SessionResponse.class).username())
        .isEqualTo("ivan");
  }

  private HttpResponse<String> post(String path, Object body) throws Exception {
    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(String.format("http://localhost:%d%s", APP.getLocalPort(), path)))
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
        .build();
    return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
  }
}
