/**
 * Copyright (c) 2011, University of Konstanz, Distributed Systems Group All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without modification, are permitted
 * provided that the following conditions are met: * Redistributions of source code must retain the
 * above copyright notice, this list of conditions and the following disclaimer. * Redistributions
 * in binary form must reproduce the above copyright notice, this list of conditions and the
 * following disclaimer in the documentation and/or other materials provided with the distribution.
 * * Neither the name of the University of Konstanz nor the names of its contributors may be used to
 * endorse or promote products derived from this software without specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND ANY EXPRESS OR
 * IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED WARRANTIES OF MERCHANTABILITY AND
 * FITNESS FOR A PARTICULAR PURPOSE ARE DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE
 * FOR ANY DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING,
 * BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE, DATA, OR PROFITS;
 * OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT,
 * STRICT LIABILITY, OR TORT (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE
 * OF THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */

package io.domscribe.service.serialize;

import static java.util.Objects.requireNonNull;

import com.google.common.base.MoreObjects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Immutable options of a builder and its writers: the XML declaration, the handling of
 * {@code null} values, namespace inheritance and the marker strings used to convert between nodes
 * and maps.
 *
 * @author Johannes Lichtenberger
 */
public final class BuilderOptions {

  /** Options with all defaults. */
  public static final BuilderOptions DEFAULTS = newBuilder().build();

  /**
   * Key of an order-preserving group in the map form: an array of maps whose entries are expanded
   * in sequence.
   */
  public static final String GROUP_KEY = "#";

  private final String version;

  private final @Nullable String encoding;

  private final @Nullable Boolean standalone;

  private final String pubID;

  private final String sysID;

  private final boolean keepNullNodes;

  private final boolean keepNullAttributes;

  private final boolean inheritNS;

  private final boolean ignoreDecorators;

  private final String convertAttKey;

  private final String convertPIKey;

  private final String convertTextKey;

  private final String convertCDataKey;

  private final String convertCommentKey;

  private BuilderOptions(final Builder builder) {
    version = builder.version;
    encoding = builder.encoding;
    standalone = builder.standalone;
    pubID = builder.pubID;
    sysID = builder.sysID;
    keepNullNodes = builder.keepNullNodes;
    keepNullAttributes = builder.keepNullAttributes;
    inheritNS = builder.inheritNS;
    ignoreDecorators = builder.ignoreDecorators;
    convertAttKey = builder.convertAttKey;
    convertPIKey = builder.convertPIKey;
    convertTextKey = builder.convertTextKey;
    convertCDataKey = builder.convertCDataKey;
    convertCommentKey = builder.convertCommentKey;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public String getVersion() {
    return version;
  }

  public @Nullable String getEncoding() {
    return encoding;
  }

  /**
   * The standalone document declaration.
   *
   * @return {@code null} if the declaration omits it
   */
  public @Nullable Boolean getStandalone() {
    return standalone;
  }

  /**
   * Public identifier of the doctype added by {@code dtd()}.
   *
   * @return the public identifier, empty for none
   */
  public String getPubID() {
    return pubID;
  }

  public String getSysID() {
    return sysID;
  }

  public boolean isKeepNullNodes() {
    return keepNullNodes;
  }

  public boolean isKeepNullAttributes() {
    return keepNullAttributes;
  }

  public boolean isInheritNS() {
    return inheritNS;
  }

  public boolean isIgnoreDecorators() {
    return ignoreDecorators;
  }

  public String getConvertAttKey() {
    return convertAttKey;
  }

  public String getConvertPIKey() {
    return convertPIKey;
  }

  public String getConvertTextKey() {
    return convertTextKey;
  }

  public String getConvertCDataKey() {
    return convertCDataKey;
  }

  public String getConvertCommentKey() {
    return convertCommentKey;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("version", version)
                      .add("encoding", encoding)
                      .add("standalone", standalone)
                      .add("pubID", pubID)
                      .add("sysID", sysID)
                      .add("keepNullNodes", keepNullNodes)
                      .add("keepNullAttributes", keepNullAttributes)
                      .add("inheritNS", inheritNS)
                      .add("ignoreDecorators", ignoreDecorators)
                      .toString();
  }

  /**
   * Builder of {@link BuilderOptions}.
   */
  public static final class Builder {

    private String version = "1.0";

    private @Nullable String encoding;

    private @Nullable Boolean standalone;

    private String pubID = "";

    private String sysID = "";

    private boolean keepNullNodes;

    private boolean keepNullAttributes;

    private boolean inheritNS = true;

    private boolean ignoreDecorators;

    private String convertAttKey = "@";

    private String convertPIKey = "?";

    private String convertTextKey = "#text";

    private String convertCDataKey = "#cdata";

    private String convertCommentKey = "#comment";

    private Builder() {
    }

    public Builder version(final String version) {
      this.version = requireNonNull(version);
      return this;
    }

    public Builder encoding(final @Nullable String encoding) {
      this.encoding = encoding;
      return this;
    }

    public Builder standalone(final @Nullable Boolean standalone) {
      this.standalone = standalone;
      return this;
    }

    public Builder pubID(final String pubID) {
      this.pubID = requireNonNull(pubID);
      return this;
    }

    public Builder sysID(final String sysID) {
      this.sysID = requireNonNull(sysID);
      return this;
    }

    /**
     * Keeps text, CDATA, comment and processing instruction nodes whose content is {@code null}.
     * They are serialized with empty content.
     *
     * @param keepNullNodes {@code true} to keep them
     * @return this {@link Builder} instance
     */
    public Builder keepNullNodes(final boolean keepNullNodes) {
      this.keepNullNodes = keepNullNodes;
      return this;
    }

    /**
     * Keeps attributes whose value is {@code null}. They are serialized with an empty value.
     *
     * @param keepNullAttributes {@code true} to keep them
     * @return this {@link Builder} instance
     */
    public Builder keepNullAttributes(final boolean keepNullAttributes) {
      this.keepNullAttributes = keepNullAttributes;
      return this;
    }

    public Builder inheritNS(final boolean inheritNS) {
      this.inheritNS = inheritNS;
      return this;
    }

    /**
     * Treats marker keys of maps as plain element names.
     *
     * @param ignoreDecorators {@code true} to turn marker handling off
     * @return this {@link Builder} instance
     */
    public Builder ignoreDecorators(final boolean ignoreDecorators) {
      this.ignoreDecorators = ignoreDecorators;
      return this;
    }

    public Builder convertAttKey(final String convertAttKey) {
      this.convertAttKey = requireNonNull(convertAttKey);
      return this;
    }

    public Builder convertPIKey(final String convertPIKey) {
      this.convertPIKey = requireNonNull(convertPIKey);
      return this;
    }

    public Builder convertTextKey(final String convertTextKey) {
      this.convertTextKey = requireNonNull(convertTextKey);
      return this;
    }

    public Builder convertCDataKey(final String convertCDataKey) {
      this.convertCDataKey = requireNonNull(convertCDataKey);
      return this;
    }

    public Builder convertCommentKey(final String convertCommentKey) {
      this.convertCommentKey = requireNonNull(convertCommentKey);
      return this;
    }

    public BuilderOptions build() {
      return new BuilderOptions(this);
    }
  }
}
