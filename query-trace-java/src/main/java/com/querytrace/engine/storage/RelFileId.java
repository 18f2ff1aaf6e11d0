package com.querytrace.engine.storage;

/** Physical identity of a relation's files: tablespace, database and relation file number. */
public record RelFileId(long tablespace, long database, long relation) {

    @Override
    public String toString() {
        return tablespace + "/" + database + "/" + relation;
    }
}
