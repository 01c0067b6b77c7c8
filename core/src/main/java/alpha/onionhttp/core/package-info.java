/**
 * Home of the library-provided application implementation.<p>
 * 
 * The public types in this package are {@link
 * alpha.onionhttp.core.DefaultApplication} and its service provider {@link
 * alpha.onionhttp.core.DefaultApplicationFactory}, which is loaded by {@link
 * alpha.onionhttp.Application#create()}. All other types in this package can
 * therefore be regarded as an implementation detail.<p>
 * 
 * Similar to classes found in other packages, implementations of public
 * interfaces provided by this package use the "Default" name-prefix. For
 * example, {@code DefaultContext} implements {@code Context}.<p>
 * 
 * Unless documented differently, all methods within this package expect to be
 * given non-null arguments and will return non-null results.
 */
package alpha.onionhttp.core;
