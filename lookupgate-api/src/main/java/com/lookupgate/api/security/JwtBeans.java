package com.lookupgate.api.security;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import com.lookupgate.api.config.LookupGateProperties;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.OctetSequenceKey;
import com.nimbusds.jose.jwk.source.ImmutableJWKSet;
import com.nimbusds.jose.jwk.source.JWKSource;
import com.nimbusds.jose.proc.SecurityContext;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtIssuerValidator;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtEncoder;

/**
 * HS256 signing material for session tokens. One secret serves both token kinds; the kind claim
 * keeps them apart.
 */
@Configuration
public class JwtBeans {

  static final String DEV_SECRET = "lookupgate-dev-secret-change-me";

  private final Environment env;

  public JwtBeans(Environment env) {
    this.env = env;
  }

  @Bean
  @ConditionalOnMissingBean(name = "jwtEncoder")
  public JwtEncoder jwtEncoder(LookupGateProperties props) {
    return encoderFor(normalizeSecret(props.auth().jwtSecret()));
  }

  @Bean
  @ConditionalOnMissingBean(name = "jwtDecoder")
  public JwtDecoder jwtDecoder(LookupGateProperties props) {
    return decoderFor(normalizeSecret(props.auth().jwtSecret()), props.auth().issuer());
  }

  public static JwtEncoder encoderFor(byte[] keyBytes) {
    var jwk = new OctetSequenceKey.Builder(keyBytes)
        .algorithm(JWSAlgorithm.HS256)
        .keyID("lookupgate-hs256")
        .build();

    JWKSource<SecurityContext> jwkSource = new ImmutableJWKSet<>(new JWKSet(jwk));
    return new NimbusJwtEncoder(jwkSource);
  }

  /**
   * Checks signature and issuer only. Expiry is checked by {@link SessionIssuer} so that an expired
   * token is reported as such rather than as a generic validation failure.
   */
  public static JwtDecoder decoderFor(byte[] keyBytes, String issuer) {
    var key = new SecretKeySpec(keyBytes, "HmacSHA256");
    NimbusJwtDecoder decoder = NimbusJwtDecoder.withSecretKey(key).macAlgorithm(MacAlgorithm.HS256).build();
    decoder.setJwtValidator(new JwtIssuerValidator(issuer));
    return decoder;
  }

  /** Derives a fixed 32-byte HS256 key from any configured secret string. */
  public static byte[] deriveKey(String secret) {
    try {
      MessageDigest md = MessageDigest.getInstance("SHA-256");
      return md.digest(secret.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  private byte[] normalizeSecret(String secret) {
    String s = (secret == null) ? "" : secret.trim();
    if (s.isEmpty()) {
      if (env.acceptsProfiles(Profiles.of("dev", "test"))) {
        s = DEV_SECRET;
      } else {
        throw new IllegalStateException("lookupgate.auth.jwt-secret is empty. Set LOOKUPGATE_JWT_SECRET.");
      }
    }
    return deriveKey(s);
  }
}
