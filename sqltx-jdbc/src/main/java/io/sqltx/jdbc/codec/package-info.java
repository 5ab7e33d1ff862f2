/**
 * Value codec for the JDBC backends: {@link io.sqltx.jdbc.codec.ParameterBinder} binds
 * dynamic parameters, and one {@link io.sqltx.jdbc.codec.RowDecoder} per backend turns result
 * rows into maps by trying an ordered list of {@link io.sqltx.jdbc.codec.ColumnProbe}s.
 */
package io.sqltx.jdbc.codec;
