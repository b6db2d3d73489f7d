package io.intellixity.unisql.server.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.intellixity.unisql.federation.schema.SchemaCacheInfo;

import java.time.Duration;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CacheInfoView(boolean exists, String cachedAt, String expiresAt, String age, int tableCount) {

  public static CacheInfoView of(SchemaCacheInfo info) {
    if (!info.exists()) return new CacheInfoView(false, null, null, null, 0);
    return new CacheInfoView(true,
        info.cachedAt().toString(),
        info.expiresAt().toString(),
        formatAge(info.age()),
        info.tableCount());
  }

  /** Coarse "time ago" text: the two largest units from days, otherwise a single unit. */
  static String formatAge(Duration age) {
    long seconds = age.getSeconds();
    long minutes = seconds / 60;
    long hours = minutes / 60;
    long days = hours / 24;
    if (days > 0) return days + "d " + (hours % 24) + "h ago";
    if (hours > 0) return hours + "h " + (minutes % 60) + "m ago";
    if (minutes > 0) return minutes + "m ago";
    return seconds + "s ago";
  }
}
