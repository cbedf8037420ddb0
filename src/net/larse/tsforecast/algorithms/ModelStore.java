/*
 * Copyright (c) 2015 Zhiqiang Yang.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */

package net.larse.tsforecast.algorithms;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import net.larse.tsforecast.errors.ModelIOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Saves and loads fitted models as Java-serialized blobs.
 *
 * <p>A save writes a temporary file next to the target and moves it into place, so readers never
 * see a partial model.
 */
public class ModelStore {
  private static final Logger logger = LoggerFactory.getLogger(ModelStore.class);

  public void save(FittedModel model, Path path) throws ModelIOException {
    Path target = path.toAbsolutePath();
    Path dir = target.getParent();
    Path temp = null;
    try {
      if (dir != null) {
        Files.createDirectories(dir);
      }
      temp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
      try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(temp));
          ObjectOutputStream objects = new ObjectOutputStream(out)) {
        objects.writeObject(model);
      }
      try {
        Files.move(
            temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
      logger.info("Saved model to {}", target);
    } catch (IOException e) {
      ModelIOException failure = new ModelIOException("Cannot save model", target.toString(), e);
      if (temp != null) {
        try {
          Files.deleteIfExists(temp);
        } catch (IOException cleanup) {
          failure.addSuppressed(cleanup);
        }
      }
      throw failure;
    }
  }

  public FittedModel load(Path path) throws ModelIOException {
    try (InputStream in = new BufferedInputStream(Files.newInputStream(path));
        ObjectInputStream objects = new ObjectInputStream(in)) {
      Object value = objects.readObject();
      if (!(value instanceof FittedModel)) {
        throw new ModelIOException(
            "File does not hold a fitted model",
            path + " (" + (value == null ? "null" : value.getClass().getName()) + ")");
      }
      return (FittedModel) value;
    } catch (IOException | ClassNotFoundException e) {
      throw new ModelIOException("Cannot load model", path.toString(), e);
    }
  }
}
