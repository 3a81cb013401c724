package io.github.themoah.edgepulse.identity;

import java.util.List;

/**
 * Fixed word tables for anomaly ids.
 *
 * <p>Ids are derived from indices into these lists, so their order and contents must never
 * change: editing a list renames every existing anomaly and orphans links and cache entries
 * that reference it.
 */
final class CarWords {

  static final List<String> ADJECTIVES = List.of(
    "alpine", "azure", "blazing", "bold", "brilliant", "chrome", "classic",
    "coastal", "cosmic", "crimson", "crystal", "daring", "dazzling", "dusty",
    "electric", "elegant", "ember", "emerald", "fierce", "fiery", "flash",
    "forest", "frozen", "gentle", "gilded", "gleaming", "golden", "granite",
    "hidden", "highland", "icy", "ivory", "jade", "jet", "lunar", "marble",
    "midnight", "misty", "moonlit", "neon", "noble", "obsidian", "ocean",
    "onyx", "opulent", "pearl", "phantom", "polar", "pristine", "radiant",
    "raven", "royal", "ruby", "rustic", "sable", "sapphire", "scarlet",
    "shadow", "silent", "silver", "sleek", "smoky", "solar", "sonic",
    "speedy", "starlit", "steel", "storm", "sunset", "swift", "teal",
    "thunder", "titan", "turbo", "twilight", "velvet", "vintage", "violet",
    "wild", "winter", "zephyr"
  );

  /** Colors for 5xx anomalies. */
  static final List<String> RED_COLORS = List.of(
    "burgundy", "cardinal", "carmine", "cerise", "cherry", "claret", "coral",
    "cranberry", "crimson", "garnet", "magenta", "maroon", "raspberry", "rose",
    "ruby", "russet", "rust", "scarlet", "vermillion", "wine"
  );

  /** Colors for 4xx anomalies. */
  static final List<String> ORANGE_COLORS = List.of(
    "amber", "apricot", "bronze", "burnt", "butterscotch", "caramel", "carrot",
    "cinnamon", "copper", "flame", "ginger", "gold", "honey", "marigold",
    "melon", "ochre", "orange", "papaya", "peach", "pumpkin", "saffron",
    "sand", "sienna", "tan", "tangerine", "tawny", "topaz", "yellow"
  );

  /** Colors for everything else (success traffic, selections). */
  static final List<String> COOL_COLORS = List.of(
    "aqua", "azure", "blue", "cerulean", "chartreuse", "cobalt", "cyan",
    "emerald", "forest", "green", "hunter", "indigo", "jade", "lagoon",
    "lime", "mint", "navy", "olive", "pacific", "pine", "sage", "seafoam",
    "spruce", "teal", "turquoise", "verdant", "viridian"
  );

  static final List<String> MODELS = List.of(
    "accord", "alpine", "beetle", "boxster", "bronco", "camaro", "camry",
    "cayenne", "challenger", "charger", "civic", "cobra", "continental",
    "corolla", "corvette", "defender", "elantra", "escort", "explorer",
    "firebird", "focus", "frontier", "fury", "galaxie", "giulia", "gto",
    "impala", "jetta", "lancer", "landcruiser", "maverick", "miata", "monte",
    "mustang", "navigator", "nova", "outback", "panda", "pantera", "passat",
    "pathfinder", "pinto", "porsche", "prelude", "prius", "quattro", "rabbit",
    "ranger", "raptor", "roadster", "safari", "scirocco", "senna", "shelby",
    "sierra", "skyline", "solara", "sonata", "spark", "spider", "stingray",
    "supra", "tacoma", "tempest", "tercel", "thunderbird", "tiguan", "torino",
    "tundra", "vantage", "viper", "wrangler", "zephyr"
  );

  private CarWords() {
  }
}
