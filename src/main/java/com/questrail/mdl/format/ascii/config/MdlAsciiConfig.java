package com.questrail.mdl.format.ascii.config;

/**
 * Options for the ASCII MDL reader and writer.
 *
 * @param flattenSkins    write skinned meshes as plain {@code trimesh} nodes,
 *                        dropping bone and weight data
 * @param strict          let a malformed line inside a node abort the whole
 *                        parse instead of truncating just that node
 * @param headerComment   text of a {@code #} comment written as the first
 *                        line, or {@code null} for none
 * @param fileDependency  {@code filedependancy} value written when the model
 *                        carries none of its own, or {@code null}
 */
public record MdlAsciiConfig(
    boolean flattenSkins,
    boolean strict,
    String headerComment,
    String fileDependency
) {
    private static final MdlAsciiConfig DEFAULTS = builder().build();

    public MdlAsciiConfig {
        if (headerComment != null && (headerComment.indexOf('\n') >= 0 || headerComment.indexOf('\r') >= 0)) {
            throw new IllegalArgumentException("headerComment must be a single line");
        }
    }

    public static MdlAsciiConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean flattenSkins;
        private boolean strict;
        private String headerComment;
        private String fileDependency;

        public Builder withFlattenSkins(boolean flattenSkins) {
            this.flattenSkins = flattenSkins;
            return this;
        }

        public Builder withStrict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public Builder withHeaderComment(String headerComment) {
            this.headerComment = headerComment;
            return this;
        }

        public Builder withFileDependency(String fileDependency) {
            this.fileDependency = fileDependency;
            return this;
        }

        public MdlAsciiConfig build() {
            return new MdlAsciiConfig(flattenSkins, strict, headerComment, fileDependency);
        }
    }
}
