package com.di.countnova.store;

/**
 * One entry of a TopN result: a dimension value (row id) and its record count.
 */
public record CountItem(long id, long count) {
}
