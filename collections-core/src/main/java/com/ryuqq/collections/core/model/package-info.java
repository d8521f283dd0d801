/**
 * Value types shared by every collection in the SDK.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.collections.core.model.Pair} - Key/value pair</li>
 *   <li>{@link com.ryuqq.collections.core.model.Lookup} - (value, found) result of lookups and writes</li>
 *   <li>{@link com.ryuqq.collections.core.model.Scored} - (item, score, found) result of max/min scans</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are records</li>
 *   <li><strong>No exceptions for absence:</strong> absence is a {@code found = false} result, never a thrown error</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Collections Team
 */
package com.ryuqq.collections.core.model;
