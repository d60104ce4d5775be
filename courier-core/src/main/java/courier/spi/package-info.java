/**
 * Extension points: transport handles, the durable side store and metrics export.
 */
package courier.spi;
