// Copyright (C) 2019 The Android Open Source Project
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.googlesource.spdx.expressions.lib;

import com.google.common.base.Preconditions;
import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Reads delimited records, usually one license expression per line, from a UTF-8 byte stream.
 *
 * <p>Tracks the number of records read so errors can name the offending record. Input that is not
 * valid UTF-8 raises {@link MalformedRecordException} rather than being silently replaced.
 */
public class ExpressionReader implements Closeable {

  public static final int BUFFER_SIZE = 2048;

  private final String name; // identifies input source
  private final BufferedReader reader; // decoded characters
  private int recordNumber; // count of records read so far

  /**
   * @param name Identifies the input source.
   * @param source Input source of UTF-8 encoded bytes.
   */
  public ExpressionReader(String name, InputStream source) {
    Preconditions.checkNotNull(source);
    this.name = Preconditions.checkNotNull(name);
    CharsetDecoder decoder =
        StandardCharsets.UTF_8
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    this.reader = new BufferedReader(new InputStreamReader(source, decoder), BUFFER_SIZE);
    this.recordNumber = 0;
  }

  /**
   * Reads a record up to the next delimiter {@code delim}, or until eof if no delimiter, appending
   * it to {@code sb}.
   *
   * <p>The appended record does not include the delimiter.
   *
   * @param delim The record delimiter. e.g. '\n' or '\000'
   * @param sb A string builder into which the record is read without the delimiter.
   * @return The number of characters read from the stream including the delimiter, or -1 at eof.
   */
  public int readString(char delim, StringBuilder sb) throws IOException {
    Preconditions.checkNotNull(sb);
    int nRead = 0;
    try {
      int c;
      while ((c = reader.read()) >= 0) {
        nRead++;
        if (c == delim) {
          break;
        }
        sb.append((char) c);
      }
    } catch (CharacterCodingException e) {
      throw new MalformedRecordException(name, recordNumber + 1, e);
    } catch (IOException e) {
      throw new ReaderIOException(e.getMessage() + " " + name, recordNumber + 1, e);
    }
    if (nRead == 0) {
      return -1;
    }
    recordNumber++;
    return nRead;
  }

  /** Returns the number of records read so far, i.e. the number of the last record read. */
  public int getRecordNumber() {
    return recordNumber;
  }

  /** Identifies the input source. */
  public String getName() {
    return name;
  }

  @Override
  public void close() throws IOException {
    reader.close();
  }

  /** Describes an IO error at a specific record of an input source. */
  public static class ReaderIOException extends IOException {
    private static final long serialVersionUID = 1L;

    private final int recordNumber;

    ReaderIOException(String message, int recordNumber, Throwable cause) {
      super(message, cause);
      this.recordNumber = recordNumber;
    }

    public int getRecordNumber() {
      return recordNumber;
    }

    @Override
    public String getMessage() {
      return super.getMessage() + " record " + recordNumber;
    }
  }

  /** Thrown when the input is not valid UTF-8. */
  public static class MalformedRecordException extends ReaderIOException {
    private static final long serialVersionUID = 1L;

    MalformedRecordException(String name, int recordNumber, Throwable cause) {
      super("Malformed UTF-8 input: " + name, recordNumber, cause);
    }
  }
}
