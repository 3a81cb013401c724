package io.github.themoah.edgepulse.investigation;

import java.util.List;
import java.util.Optional;

/**
 * Facets examined by anomaly and selection investigations.
 */
public final class FacetCatalog {

  public static final List<FacetDefinition> INVESTIGATED = List.of(
    FacetDefinition.of("hosts", "`request.host`"),
    FacetDefinition.of("forwarded-hosts", "`request.headers.x_forwarded_host`"),
    FacetDefinition.of("paths", "`request.url`"),
    new FacetDefinition("errors", "`response.headers.x_error`",
      "AND `response.headers.x_error` != ''"),
    FacetDefinition.of("user-agents", "`request.headers.user_agent`"),
    FacetDefinition.of("ips",
      "if(`request.headers.x_forwarded_for` != '', `request.headers.x_forwarded_for`, `client.ip`)"),
    new FacetDefinition("asn",
      "concat(toString(`client.asn`), ' ', dictGet('helix_logs_production.asn_dict', 'name', `client.asn`))",
      "AND `client.asn` != 0"),
    FacetDefinition.of("datacenters", "`cdn.datacenter`"),
    FacetDefinition.of("cache", "upper(`cdn.cache_status`)"),
    FacetDefinition.of("content-types", "`response.headers.content_type`"),
    new FacetDefinition("backend-type", "`helix.backend_type`",
      "AND `helix.backend_type` != ''")
  );

  private FacetCatalog() {
  }

  public static Optional<FacetDefinition> find(String id) {
    return INVESTIGATED.stream().filter(f -> f.id().equals(id)).findFirst();
  }
}
