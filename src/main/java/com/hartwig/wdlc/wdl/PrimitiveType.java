package com.hartwig.wdlc.wdl;

public enum PrimitiveType implements WdlType {
    BOOLEAN("Boolean") {
        @Override
        public <T> T accept(final WdlTypeVisitor<T> visitor) {
            return visitor.visitBoolean();
        }
    },
    INT("Int") {
        @Override
        public <T> T accept(final WdlTypeVisitor<T> visitor) {
            return visitor.visitInt();
        }
    },
    FLOAT("Float") {
        @Override
        public <T> T accept(final WdlTypeVisitor<T> visitor) {
            return visitor.visitFloat();
        }
    },
    STRING("String") {
        @Override
        public <T> T accept(final WdlTypeVisitor<T> visitor) {
            return visitor.visitString();
        }
    },
    FILE("File") {
        @Override
        public <T> T accept(final WdlTypeVisitor<T> visitor) {
            return visitor.visitFile();
        }
    };

    private final String typeName;

    PrimitiveType(final String typeName) {
        this.typeName = typeName;
    }

    @Override
    public String typeName() {
        return typeName;
    }
}
