/**
 * JDK {@code java.net.http.HttpClient} 기반 transport.
 *
 * @since 1.0.0
 */
package com.ryuqq.conduit.adapter.jdkhttp;
