package com.sayou.fabric.model;

/** Node classes, predicates and attribute keys shared by the reference mapper and builder. */
public final class Vocabulary {
  private Vocabulary() {}

  public static final String ID_PREFIX = "sayou:doc:";

  public static final String CLASS_DOCUMENT = "sayou:Document";
  public static final String CLASS_TOPIC = "sayou:Topic";
  public static final String CLASS_TABLE = "sayou:Table";
  public static final String CLASS_CODE = "sayou:Code";
  public static final String CLASS_LIST_ITEM = "sayou:ListItem";
  public static final String CLASS_TEXT = "sayou:TextFragment";

  public static final String HAS_PARENT = "sayou:hasParent";
  public static final String NEXT = "sayou:next";

  /** Suffix of the predicate linking a target back to its source. */
  public static final String REVERSE_SUFFIX = "_by";

  public static final String ATTR_TEXT = "schema:text";
  public static final String ATTR_TITLE = "schema:name";
  public static final String ATTR_SEMANTIC_TYPE = "sayou:semanticType";
  public static final String ATTR_PART_INDEX = "sayou:partIndex";
  public static final String ATTR_SOURCE = "sayou:source";
  public static final String ATTR_MEDIA_TYPE = "sayou:mediaType";

  public static String nodeId(String rawId) {
    return ID_PREFIX + rawId;
  }

  public static String reverse(String predicate) {
    return predicate + REVERSE_SUFFIX;
  }
}
