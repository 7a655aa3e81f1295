package com.samplesift.query;

import com.samplesift.record.Record;

/** Compiled form of a query expression. */
interface QueryNode {

    boolean test(Record record);
}
