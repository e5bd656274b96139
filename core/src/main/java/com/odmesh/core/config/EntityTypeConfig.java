package com.odmesh.core.config;

import java.net.URI;

public record EntityTypeConfig(
        String typeName,
        String collectionName,
        String urlBase
) {
    public static final String DEFAULT_TYPE_NAME = "ODataSchema.Entity";
    public static final String DEFAULT_COLLECTION_NAME = "Entities";

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String typeName = DEFAULT_TYPE_NAME;
        private String collectionName = DEFAULT_COLLECTION_NAME;
        private String urlBase = "";

        public Builder typeName(String typeName) {
            this.typeName = typeName;
            return this;
        }

        public Builder collectionName(String collectionName) {
            this.collectionName = collectionName;
            return this;
        }

        public Builder urlBase(String urlBase) {
            this.urlBase = urlBase;
            return this;
        }

        public Builder urlBase(URI urlBase) {
            this.urlBase = urlBase.toString();
            return this;
        }

        public EntityTypeConfig build() {
            return new EntityTypeConfig(typeName, collectionName, urlBase == null ? "" : urlBase);
        }
    }
}
