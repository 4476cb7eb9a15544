package io.buildunion.factcore.citation;

/**
 * Semantic identity of a citation: its type plus, for multi-instance types, the instance identifier
 * from metadata. A multi-instance citation without its identifier is keyed by its own id so that it
 * never collides with another.
 */
public record CitationKey(String citeType, String instance) {

  public static CitationKey of(Citation citation) {
    var known = CiteType.find(citation.citeType());
    if (known.isPresent() && known.get().isMultiInstance()) {
      String instance = citation.metadataString(known.get().instanceKey());
      String key = instance != null ? instance : "#" + citation.id();
      return new CitationKey(citation.citeType(), key);
    }
    return new CitationKey(citation.citeType(), null);
  }

  public static CitationKey single(CiteType type) {
    return new CitationKey(type.name(), null);
  }

  public static CitationKey instance(CiteType type, String instance) {
    return new CitationKey(type.name(), instance);
  }
}
