package com.libragraph.weather.core.storage;

@FunctionalInterface
public interface TransactionCallback<R, X extends Exception> {

    R withTransaction(WriteTransaction tx) throws X;
}
