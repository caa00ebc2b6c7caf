/**
 * Spring integration: {@link dbexec.Transaction}s whose lifecycle is managed by a
 * {@link org.springframework.transaction.PlatformTransactionManager}.
 *
 * @see dbexec.spring.SpringTransaction
 * @see dbexec.spring.SpringTransactionFactory
 */
package dbexec.spring;
