package com.flinspect.core.graph;

import com.google.gson.annotations.SerializedName;
import java.util.List;
import java.util.Map;

/**
 * POJOs of the exported graph, schema v0.1.
 * Field names use @SerializedName for JSON snake_case mapping.
 */
public final class GraphModel {

    private GraphModel() {}

    public static class GraphRoot {
        @SerializedName("format_version") public String formatVersion;
        @SerializedName("tool_version")   public String toolVersion;
        @SerializedName("units")          public List<GraphUnit> units;
        @SerializedName("contains")       public List<GraphContains> contains;
        @SerializedName("uses")           public List<GraphUses> uses;
        @SerializedName("calls")          public List<GraphCall> calls;
        @SerializedName("diagnostics")    public List<GraphDiagnostic> diagnostics;
    }

    public static class GraphUnit {
        @SerializedName("id")              public String id;
        @SerializedName("kind")            public String kind;        // module, program, subroutine, function, interface, type
        @SerializedName("name")            public String name;
        @SerializedName("qualified_name")  public String qualifiedName;
        @SerializedName("container")       public String container;   // nullable
        @SerializedName("source_file")     public String sourceFile;  // null for placeholders
        @SerializedName("line")            public int line;
        @SerializedName("shadowed")        public boolean shadowed;
        @SerializedName("arguments")       public List<GraphArgument> arguments;
        @SerializedName("result_type")     public String resultType;
        @SerializedName("members")         public List<String> members;
        @SerializedName("unbound_members") public List<String> unboundMembers;
        @SerializedName("components")      public List<GraphArgument> components;
        @SerializedName("variables")       public List<GraphArgument> variables;
    }

    /** Shared by dummy arguments, components and variables. */
    public static class GraphArgument {
        @SerializedName("name")     public String name;
        @SerializedName("type")     public String type;
        @SerializedName("rank")     public Integer rank;    // null when unknown
        @SerializedName("optional") public Boolean optional;
        @SerializedName("intent")   public String intent;
    }

    public static class GraphContains {
        @SerializedName("parent") public String parent;
        @SerializedName("child")  public String child;
    }

    public static class GraphUses {
        @SerializedName("from")    public String from;
        @SerializedName("module")  public String module;
        @SerializedName("only")    public List<String> only;     // null when unrestricted
        @SerializedName("renames") public Map<String, String> renames;
        @SerializedName("line")    public int line;
    }

    public static class GraphCall {
        @SerializedName("id")          public String id;
        @SerializedName("caller")      public String caller;
        @SerializedName("callee_name") public String calleeName;
        @SerializedName("status")      public String status;
        @SerializedName("candidates")  public List<String> candidates;
        @SerializedName("via")         public List<String> via;
        @SerializedName("source_file") public String sourceFile;
        @SerializedName("line")        public int line;
        @SerializedName("argument_count") public int argumentCount;
    }

    public static class GraphDiagnostic {
        @SerializedName("kind")        public String kind;
        @SerializedName("source_file") public String sourceFile;
        @SerializedName("line")        public int line;
        @SerializedName("subject")     public String subject;
        @SerializedName("message")     public String message;
    }
}
