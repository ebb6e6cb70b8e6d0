/**
 * Builders of the gold star schema: {@code dim_customers}, {@code dim_products} and
 * {@code fact_sales}.
 */
package io.github.yok.dwloader.gold;
