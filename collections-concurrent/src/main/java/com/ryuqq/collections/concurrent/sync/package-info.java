/**
 * Reader/writer locked dictionary.
 *
 * @since 1.0.0
 */
package com.ryuqq.collections.concurrent.sync;
