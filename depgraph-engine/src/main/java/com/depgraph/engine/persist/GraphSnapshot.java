package com.depgraph.engine.persist;

import com.depgraph.engine.graph.Confidence;
import com.depgraph.engine.graph.ReferenceForm;
import com.depgraph.engine.graph.RelationKind;
import com.google.gson.annotations.SerializedName;

import java.util.List;
import java.util.Map;

/**
 * POJOs of the graph_snapshot.json document, format version 1.
 * Field names use @SerializedName for JSON snake_case mapping.
 */
public final class GraphSnapshot {

    public static final int FORMAT_VERSION = 1;

    private GraphSnapshot() {}

    public static class SnapshotRoot {
        @SerializedName("format_version") public int formatVersion;
        @SerializedName("saved_at")       public String savedAt;
        @SerializedName("files")          public List<SnapshotFile> files;
        @SerializedName("symbols")        public List<SnapshotSymbol> symbols;
        @SerializedName("edges")          public List<SnapshotEdge> edges;
        @SerializedName("checksums")      public Map<String, String> checksums;
    }

    public static class SnapshotFile {
        @SerializedName("path")        public String path;
        @SerializedName("language")    public String language;
        @SerializedName("digest")      public String digest;
        @SerializedName("last_synced") public String lastSynced;   // ISO-8601 instant
        @SerializedName("tombstoned")  public boolean tombstoned;
    }

    public static class SnapshotSymbol {
        @SerializedName("id")         public String id;
        @SerializedName("file_id")    public String fileId;
        @SerializedName("name")       public String name;
        @SerializedName("signature")  public String signature;
        @SerializedName("arity")      public int arity;
        @SerializedName("line_start") public int lineStart;
        @SerializedName("line_end")   public int lineEnd;
        @SerializedName("leaf")       public boolean leaf;
        @SerializedName("tombstoned") public boolean tombstoned;
    }

    public static class SnapshotEdge {
        @SerializedName("source")            public String source;
        @SerializedName("target_symbol")     public String targetSymbol;     // nullable
        @SerializedName("target_external")   public String targetExternal;   // nullable
        @SerializedName("kind")              public RelationKind kind;
        @SerializedName("confidence")        public Confidence confidence;
        @SerializedName("form")              public ReferenceForm form;
        @SerializedName("target_name")       public String targetName;
        @SerializedName("target_arity")      public int targetArity;
        @SerializedName("observation_count") public long observationCount;
    }
}
