package ddlsync.api.metadata.command;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Binds a {@link CommandHandler} class to the {@link Command} record it answers. Handlers without
 * it are ignored at registration.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface HandlesCommand {

  @SuppressWarnings("rawtypes")
  Class<? extends Command> value();
}
