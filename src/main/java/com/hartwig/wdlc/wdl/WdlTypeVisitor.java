package com.hartwig.wdlc.wdl;

public interface WdlTypeVisitor<T> {
    T visitBoolean();

    T visitInt();

    T visitFloat();

    T visitString();

    T visitFile();

    T visitOptional(OptionalType type);

    T visitArray(ArrayType type);

    T visitMap(MapType type);

    T visitPair(PairType type);

    T visitStruct(StructType type);

    T visitObject(ObjectType type);
}
