package com.gt.recall.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.security.Key;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;
import java.util.function.Function;

// Verifies HS256 tokens issued by the external authentication provider. The token subject is the owner id.
@Component
public class JwtService {

    private final String secret;
    private final Clock clock;

    public JwtService(@Value("${server.jwt.secret}") String secret, Clock clock) {
        this.secret = secret;
        this.clock = clock;
    }

    public String extractOwnerId(String token) {
        return extractClaim(token, Claims::getSubject);
    }

    public Instant extractExpiration(String token) {
        Date expiration = extractClaim(token, Claims::getExpiration);
        return expiration == null ? null : expiration.toInstant();
    }

    public <T> T extractClaim(String token, Function<Claims, T> claimsResolver) {
        final Claims claims = extractAllClaims(token);
        return claimsResolver.apply(claims);
    }

    private Claims extractAllClaims(String token) {
        return Jwts.parserBuilder()
                .setSigningKey(getSignKey())
                .setClock(() -> Date.from(clock.instant()))
                .build()
                .parseClaimsJws(token)
                .getBody();
    }

    private boolean isTokenExpired(String token) {
        Instant expiration = extractExpiration(token);
        return expiration != null && expiration.isBefore(clock.instant());
    }

    public boolean validateToken(String token) {
        String ownerId = extractOwnerId(token);
        return ownerId != null && !ownerId.isBlank() && !isTokenExpired(token);
    }

    private Key getSignKey() {
        byte[] keyBytes = Base64.getDecoder().decode(this.secret);
        return Keys.hmacShaKeyFor(keyBytes);
    }
}
