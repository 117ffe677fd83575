/*
 * Copyright by the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package org.descriptorj.descriptor;

import com.google.common.collect.ImmutableList;
import org.descriptorj.core.ECKey;
import org.descriptorj.core.NetworkParameters;
import org.descriptorj.script.Script;
import org.descriptorj.script.ScriptBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Turns a descriptor into the output scripts it describes.
 *
 * <p>Every expression produces one script, except {@code combo(KEY)} which produces P2PK and P2PKH scripts and, for a
 * compressed key, P2WPKH and P2SH-P2WPKH scripts, in that order. A ranged or multipath descriptor describes many
 * scripts and has to be narrowed with {@link DescriptorDocument#atIndex(int)} and
 * {@link DescriptorDocument#expandMultipath()} first, or through {@link #build(DescriptorDocument, int)}.</p>
 */
public class DescriptorScriptBuilder {
    private static final Logger log = LoggerFactory.getLogger(DescriptorScriptBuilder.class);

    private final NetworkParameters params;

    public DescriptorScriptBuilder(NetworkParameters params) {
        this.params = checkNotNull(params);
    }

    public NetworkParameters getParams() {
        return params;
    }

    /**
     * Builds the scripts of a descriptor that has neither wildcards nor multipath steps.
     *
     * @throws DescriptorDerivationException if the descriptor is ranged or has multipath steps, or a key cannot be
     *         derived
     */
    public List<Script> build(DescriptorDocument document) throws DescriptorDerivationException {
        if (document.isRange())
            throw new DescriptorDerivationException("Ranged descriptor " + document.toStringWithoutChecksum()
                    + " needs an index");
        if (document.getMultipathCount() > 1)
            throw new DescriptorDerivationException("Multipath descriptor " + document.toStringWithoutChecksum()
                    + " must be expanded first");
        List<Script> scripts = build(document.getRoot());
        log.debug("{} produced {} script(s)", document, scripts.size());
        return Collections.unmodifiableList(scripts);
    }

    /**
     * Builds the scripts of a descriptor at the given index, for every multipath alternative. The result holds one
     * list of scripts per alternative. The index is ignored if the descriptor is not ranged.
     */
    public List<List<Script>> build(DescriptorDocument document, int index) throws DescriptorDerivationException {
        ImmutableList.Builder<List<Script>> result = ImmutableList.builder();
        for (DescriptorDocument branch : document.expandMultipath())
            result.add(build(branch.atIndex(index)));
        return result.build();
    }

    private List<Script> build(ScriptExpression expression) throws DescriptorDerivationException {
        List<Script> scripts = new ArrayList<>();
        switch (expression.getType()) {
            case PK:
                scripts.add(ScriptBuilder.createP2PKOutputScript(resolve(expression)));
                break;
            case PKH:
                scripts.add(ScriptBuilder.createP2PKHOutputScript(resolve(expression)));
                break;
            case WPKH:
                scripts.add(ScriptBuilder.createP2WPKHOutputScript(resolve(expression)));
                break;
            case COMBO: {
                ECKey key = resolve(expression);
                scripts.add(ScriptBuilder.createP2PKOutputScript(key));
                scripts.add(ScriptBuilder.createP2PKHOutputScript(key));
                if (key.isCompressed()) {
                    Script p2wpkh = ScriptBuilder.createP2WPKHOutputScript(key);
                    scripts.add(p2wpkh);
                    scripts.add(ScriptBuilder.createP2SHOutputScript(p2wpkh));
                }
                break;
            }
            case SH:
                scripts.add(ScriptBuilder.createP2SHOutputScript(buildInner(expression)));
                break;
            case WSH:
                scripts.add(ScriptBuilder.createP2WSHOutputScript(buildInner(expression)));
                break;
            case MULTI:
            case SORTED_MULTI: {
                MultisigScriptExpression multi = (MultisigScriptExpression) expression;
                List<ECKey> keys = new ArrayList<>(multi.getKeys().size());
                for (KeyExpression key : multi.getKeys())
                    keys.add(key.resolve());
                if (multi.isSorted())
                    Collections.sort(keys, ECKey.PUBKEY_COMPARATOR);
                scripts.add(ScriptBuilder.createMultiSigOutputScript(multi.getThreshold(), keys));
                break;
            }
            case ADDR:
                scripts.add(ScriptBuilder.createOutputScript(((AddrScriptExpression) expression).getAddress()));
                break;
            case RAW:
                scripts.add(new Script(((RawScriptExpression) expression).getProgram()));
                break;
            default:
                throw new IllegalStateException("Unknown expression type " + expression.getType());
        }
        return scripts;
    }

    private Script buildInner(ScriptExpression wrapper) throws DescriptorDerivationException {
        List<Script> inner = build(((WrapperScriptExpression) wrapper).getInner());
        if (inner.size() != 1)
            throw new DescriptorDerivationException("Cannot wrap " + inner.size() + " scripts in "
                    + wrapper.getType().functionName() + "()");
        return inner.get(0);
    }

    private static ECKey resolve(ScriptExpression expression) throws DescriptorDerivationException {
        return ((KeyScriptExpression) expression).getKey().resolve();
    }
}
