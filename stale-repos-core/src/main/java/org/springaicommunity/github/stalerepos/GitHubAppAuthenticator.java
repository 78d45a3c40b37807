package org.springaicommunity.github.stalerepos;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.Jwts;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.security.PrivateKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.function.Function;

/**
 * Exchanges GitHub App credentials for an installation access token.
 *
 * <p>
 * A short-lived RS256 JWT is signed with the app's private key (issuer = app id) and
 * posted to {@code /app/installations/{id}/access_tokens}. The returned token is then used
 * like a personal access token.
 */
public class GitHubAppAuthenticator {

	private static final Logger logger = LoggerFactory.getLogger(GitHubAppAuthenticator.class);

	static final Duration JWT_LIFETIME = Duration.ofMinutes(9);

	// GitHub rejects tokens issued in the future; back-date for clock drift
	static final Duration JWT_BACKDATE = Duration.ofSeconds(60);

	private final long appId;

	private final long installationId;

	private final PrivateKey privateKey;

	private final ObjectMapper objectMapper;

	private final Clock clock;

	/**
	 * @param appId GitHub App id
	 * @param installationId installation id of the app in the scanned account
	 * @param privateKeyPem PKCS#1 or PKCS#8 PEM private key
	 * @param objectMapper mapper for the token response
	 * @param clock clock for the JWT timestamps
	 * @throws IllegalArgumentException if the private key cannot be read
	 */
	public GitHubAppAuthenticator(long appId, long installationId, String privateKeyPem, ObjectMapper objectMapper,
			Clock clock) {
		this.appId = appId;
		this.installationId = installationId;
		this.privateKey = parsePrivateKey(privateKeyPem);
		this.objectMapper = objectMapper;
		this.clock = clock;
	}

	static PrivateKey parsePrivateKey(String pem) {
		// Single-line secrets carry escaped newlines
		String normalized = pem.replace("\\n", "\n");
		try (PEMParser parser = new PEMParser(new StringReader(normalized))) {
			Object parsed = parser.readObject();
			JcaPEMKeyConverter converter = new JcaPEMKeyConverter();
			if (parsed instanceof PEMKeyPair) {
				return converter.getKeyPair((PEMKeyPair) parsed).getPrivate();
			}
			if (parsed instanceof PrivateKeyInfo) {
				return converter.getPrivateKey((PrivateKeyInfo) parsed);
			}
			throw new IllegalArgumentException("GH_APP_PRIVATE_KEY is not a PEM encoded private key");
		}
		catch (IOException e) {
			throw new IllegalArgumentException("GH_APP_PRIVATE_KEY could not be read: " + e.getMessage(), e);
		}
	}

	/**
	 * Sign the app JWT.
	 * @return compact JWT
	 */
	public String createJwt() {
		Instant now = clock.instant();
		return Jwts.builder()
			.issuer(String.valueOf(appId))
			.issuedAt(Date.from(now.minus(JWT_BACKDATE)))
			.expiration(Date.from(now.plus(JWT_LIFETIME)))
			.signWith(privateKey, Jwts.SIG.RS256)
			.compact();
	}

	/**
	 * Request an installation access token.
	 * @param clientForJwt creates a client that authenticates with the given JWT
	 * @return installation token
	 * @throws GitHubHttpClient.GitHubApiException if GitHub rejects the exchange
	 * @throws UnexpectedPayloadException if the response carries no token
	 */
	public String fetchInstallationToken(Function<String, GitHubHttpClient> clientForJwt) {
		GitHubHttpClient client = clientForJwt.apply(createJwt());
		logger.info("Requesting installation token for GitHub App {} (installation {})", appId, installationId);
		String response = client.post("/app/installations/" + installationId + "/access_tokens", "{}");
		try {
			JsonNode node = objectMapper.readTree(response);
			String token = node.path("token").asText(null);
			if (token == null || token.isBlank()) {
				throw new UnexpectedPayloadException("Installation token response has no token");
			}
			logger.debug("Installation token expires at {}", node.path("expires_at").asText("unknown"));
			return token;
		}
		catch (JsonProcessingException e) {
			throw new UnexpectedPayloadException("Invalid installation token response: " + e.getMessage(), e);
		}
	}

}
