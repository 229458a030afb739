/*
 * Copyright 2024 Responsive Computing, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.athenz.syncer.zms.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.google.common.annotations.VisibleForTesting;
import dev.athenz.syncer.zms.auth.CredentialSource;
import dev.athenz.syncer.zms.auth.ReloadingKeyManager;
import dev.athenz.syncer.zms.model.DomainSnapshot;
import dev.athenz.syncer.zms.model.SignedDomains;
import dev.athenz.syncer.zms.model.SignedDomains.DomainData;
import dev.athenz.syncer.zms.model.SignedDomains.Role;
import dev.athenz.syncer.zms.model.SignedDomains.RoleMember;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.stream.Collectors;
import javax.net.ssl.SSLContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ZmsHttpClient implements ZmsClient {
  private static final Logger LOG = LoggerFactory.getLogger(ZmsHttpClient.class);

  private static final String MODIFIED_DOMAINS_PATH = "/sys/modified_domains";
  private static final String ROLE_INFIX = ":role.";

  private final String baseUrl;
  private final Duration requestTimeout;
  private final boolean disableKeepAlives;
  private final Factories factories;
  private final Clock clock;
  private final ObjectMapper mapper;
  private final HttpClient sharedClient;

  public ZmsHttpClient(
      final String zmsUrl,
      final CredentialSource credentials,
      final boolean disableKeepAlives,
      final Duration requestTimeout
  ) {
    this(
        zmsUrl,
        disableKeepAlives,
        requestTimeout,
        new Factories() {
          private final SSLContext sslContext = ReloadingKeyManager.sslContext(credentials);

          @Override
          public HttpClient createHttpClient() {
            return HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(requestTimeout)
                .sslContext(sslContext)
                .build();
          }
        },
        Clock.systemUTC()
    );
  }

  @VisibleForTesting
  ZmsHttpClient(
      final String zmsUrl,
      final boolean disableKeepAlives,
      final Duration requestTimeout,
      final Factories factories,
      final Clock clock
  ) {
    this.baseUrl = stripTrailingSlash(Objects.requireNonNull(zmsUrl, "zmsUrl"));
    this.requestTimeout = Objects.requireNonNull(requestTimeout);
    this.disableKeepAlives = disableKeepAlives;
    this.factories = Objects.requireNonNull(factories);
    this.clock = Objects.requireNonNull(clock);
    this.mapper = new ObjectMapper();
    mapper.registerModule(new Jdk8Module());
    // without keep-alive every request gets its own client, and with it a fresh
    // connection whose handshake sees the latest identity
    this.sharedClient = disableKeepAlives ? null : factories.createHttpClient();
    LOG.info("Created zms client for {} (keep-alive {})",
        baseUrl, disableKeepAlives ? "disabled" : "enabled");
  }

  @Override
  public Optional<DomainSnapshot> getDomainSnapshot(final String domainName) {
    final URI uri = URI.create(baseUrl + MODIFIED_DOMAINS_PATH
        + "?domain=" + URLEncoder.encode(domainName, StandardCharsets.UTF_8));
    final HttpResponse<String> response = send(newRequest(uri).GET().build());
    if (response.statusCode() == 404) {
      LOG.debug("Domain {} not found in zms", domainName);
      return Optional.empty();
    }
    throwOnError(response, "get domain " + domainName);

    final SignedDomains signedDomains = parse(response.body(), "domain " + domainName);
    final Instant now = clock.instant();
    return signedDomains.getDomains().stream()
        .map(SignedDomains.SignedDomain::getDomain)
        .filter(Objects::nonNull)
        .filter(d -> domainName.equals(d.getName()))
        .findFirst()
        .map(d -> toSnapshot(d, now));
  }

  @Override
  public ModifiedDomains getModifiedDomains(final Optional<String> etag) {
    final URI uri = URI.create(baseUrl + MODIFIED_DOMAINS_PATH + "?metaonly=true");
    final HttpRequest.Builder builder = newRequest(uri).GET();
    etag.ifPresent(tag -> builder.header("If-None-Match", tag));
    final HttpResponse<String> response = send(builder.build());
    if (response.statusCode() == 304) {
      return ModifiedDomains.notModified(etag);
    }
    throwOnError(response, "list modified domains");

    final SignedDomains signedDomains = parse(response.body(), "modified domains");
    final List<String> names = signedDomains.getDomains().stream()
        .map(SignedDomains.SignedDomain::getDomain)
        .filter(Objects::nonNull)
        .map(DomainData::getName)
        .filter(Objects::nonNull)
        .collect(Collectors.toList());
    return ModifiedDomains.changed(names, response.headers().firstValue("ETag"));
  }

  private HttpRequest.Builder newRequest(final URI uri) {
    return HttpRequest.newBuilder()
        .uri(uri)
        .timeout(requestTimeout)
        .header("Accept", "application/json");
  }

  private HttpResponse<String> send(final HttpRequest request) {
    final HttpClient client = disableKeepAlives ? factories.createHttpClient() : sharedClient;
    try {
      return client.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (final IOException e) {
      throw new RetriableZmsException(
          "zms request " + request.uri() + " failed: " + e.getMessage(), e);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RetriableZmsException("interrupted waiting for zms request " + request.uri(), e);
    }
  }

  private static void throwOnError(final HttpResponse<String> response, final String operation) {
    final int status = response.statusCode();
    if (status >= 200 && status < 300) {
      return;
    }
    final String message = String.format(
        "zms call to %s failed with status %d: %s", operation, status, response.body());
    if (isRetriable(status)) {
      throw new RetriableZmsException(message, OptionalInt.of(status));
    }
    throw new ZmsException(message, OptionalInt.of(status), null);
  }

  @VisibleForTesting
  static boolean isRetriable(final int status) {
    return status == 401 || status == 403 || status == 408 || status == 429 || status >= 500;
  }

  private SignedDomains parse(final String body, final String what) {
    try {
      return mapper.readValue(body, SignedDomains.class);
    } catch (final JsonProcessingException e) {
      throw new ZmsException("malformed zms response for " + what, e);
    }
  }

  /**
   * Maps ZMS domain data to a snapshot keyed by short role names. Members whose expiration has
   * passed are dropped, ZMS keeps returning them until they are cleaned up.
   */
  @VisibleForTesting
  static DomainSnapshot toSnapshot(final DomainData domain, final Instant now) {
    final String domainName = domain.getName();
    final DomainSnapshot.Builder builder = DomainSnapshot.builder(domainName)
        .withFetchedAt(now)
        .withModified(domain.getModified().map(m -> parseTimestamp(m, domainName)).orElse(null));
    final String rolePrefix = domainName + ROLE_INFIX;
    for (final Role role : domain.getRoles()) {
      if (!role.getName().startsWith(rolePrefix)) {
        throw new ZmsException("role " + role.getName() + " does not belong to " + domainName);
      }
      final String shortName = role.getName().substring(rolePrefix.length());
      if (role.getTrust().isPresent()) {
        builder.withDelegatedRole(shortName, role.getTrust().get());
      } else {
        builder.withRole(shortName, activeMembers(role, now, domainName));
      }
    }
    return builder.build();
  }

  private static Set<String> activeMembers(
      final Role role,
      final Instant now,
      final String domainName
  ) {
    if (role.getRoleMembers().isEmpty()) {
      return new LinkedHashSet<>(role.getMembers());
    }
    final Set<String> members = new LinkedHashSet<>();
    for (final RoleMember member : role.getRoleMembers()) {
      final Optional<Instant> expiration =
          member.getExpiration().map(e -> parseTimestamp(e, domainName));
      if (expiration.isEmpty() || expiration.get().isAfter(now)) {
        members.add(member.getMemberName());
      }
    }
    return members;
  }

  private static Instant parseTimestamp(final String timestamp, final String domainName) {
    try {
      return Instant.parse(timestamp);
    } catch (final DateTimeParseException e) {
      throw new ZmsException("bad timestamp " + timestamp + " in domain " + domainName, e);
    }
  }

  private static String stripTrailingSlash(final String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }

  interface Factories {
    HttpClient createHttpClient();
  }
}
