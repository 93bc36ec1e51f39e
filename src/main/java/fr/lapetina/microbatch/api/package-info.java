/**
 * HTTP surface of the classifier, built on the JDK's {@code com.sun.net.httpserver}.
 */
package fr.lapetina.microbatch.api;
