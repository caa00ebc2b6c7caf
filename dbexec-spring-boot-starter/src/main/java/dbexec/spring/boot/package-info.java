/**
 * Spring Boot auto-configuration for the executor resolver.
 *
 * @see dbexec.spring.boot.ExecutorAutoConfiguration
 * @see dbexec.spring.boot.ExecutorMicrometerAutoConfiguration
 * @see dbexec.spring.boot.ExecutorProperties
 */
package dbexec.spring.boot;
