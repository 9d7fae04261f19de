package org.danilorossi.spamc.helpers;

import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import lombok.Cleanup;
import lombok.NonNull;
import lombok.experimental.UtilityClass;
import lombok.val;

@UtilityClass
public final class MailUtils {

  /**
   * Converte un jakarta.mail.Message in RFC822 bytes (header + body) usando writeTo(). Usa CRLF
   * corrette e mantiene intatti gli header.
   */
  public static byte[] toRfc822Bytes(@NonNull final Message message) throws IOException {
    @Cleanup val baos = new ByteArrayOutputStream(64 * 1024);
    try {
      message.writeTo(baos);
    } catch (MessagingException e) {
      // Riconfeziono in IOException per coerenza con le altre API I/O del client
      throw new IOException("Failed to serialize jakarta.mail.Message to RFC822", e);
    }
    return baos.toByteArray();
  }
}
