package com.fieldops.api.security;

import com.fieldops.api.config.FieldOpsProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * HS256 decoder for bearer tokens. Tokens are issued elsewhere; this service only verifies them.
 */
@Configuration
public class JwtBeans {

  static final String DEV_SECRET = "fieldops-dev-secret-change-me";

  private final Environment env;

  public JwtBeans(Environment env) {
    this.env = env;
  }

  @Bean
  @ConditionalOnMissingBean(name = "jwtDecoder")
  public JwtDecoder jwtDecoder(FieldOpsProperties props) {
    var key = new SecretKeySpec(signingKey(props.auth().jwtSecret()), "HmacSHA256");
    return NimbusJwtDecoder.withSecretKey(key).macAlgorithm(MacAlgorithm.HS256).build();
  }

  /**
   * Any configured secret string is hashed to a fixed 32-byte key.
   * A blank secret is only tolerated under the dev profile.
   */
  byte[] signingKey(String secret) {
    String s = (secret == null) ? "" : secret.trim();
    if (s.isEmpty()) {
      if (env.acceptsProfiles(Profiles.of("dev"))) {
        s = DEV_SECRET;
      } else {
        throw new IllegalStateException("fieldops.auth.jwt-secret is empty. Set FIELDOPS_JWT_SECRET.");
      }
    }
    try {
      MessageDigest md = MessageDigest.getInstance("SHA-256");
      return md.digest(s.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
